package com.servicescaffold.core.events.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.events.errors.PipelineErrorKind;
import com.servicescaffold.core.events.errors.PipelineException;
import java.util.Objects;

public class IntegrationEventJsonCodec {
  private final ObjectMapper objectMapper;

  public IntegrationEventJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(IntegrationEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new PipelineException(
          PipelineErrorKind.SERIALIZATION,
          EventTypeNames.of(event),
          null,
          "Failed to encode integration event",
          ex);
    }
  }

  /**
   * Decodes a payload into the expected event type. A payload that is empty, {@code null} JSON,
   * or lacks the identifier or timestamp is rejected as undeliverable.
   */
  public <T extends IntegrationEvent> T decode(String json, Class<T> eventType) {
    String typeName = EventTypeNames.of(eventType);
    if (json == null || json.isBlank()) {
      throw new PipelineException(
          PipelineErrorKind.DESERIALIZATION, typeName, null, "Empty event payload", null);
    }

    T event;
    try {
      event = objectMapper.readValue(json, eventType);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new PipelineException(
          PipelineErrorKind.DESERIALIZATION, typeName, null, "Failed to decode event payload", ex);
    }

    if (event == null || event.id() == null || event.occurredOn() == null) {
      throw new PipelineException(
          PipelineErrorKind.DESERIALIZATION,
          typeName,
          null,
          "Decoded event is missing its id or occurrence timestamp",
          null);
    }
    return event;
  }
}
