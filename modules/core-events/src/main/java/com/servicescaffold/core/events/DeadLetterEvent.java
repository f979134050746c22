package com.servicescaffold.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Wraps an event whose processing failed permanently, for inspection or replay. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetterEvent(
    UUID id,
    Instant occurredOn,
    String originalEventType,
    UUID originalEventId,
    String originalEventJson,
    String errorMessage,
    String stackTrace,
    FailureKind failureKind,
    int attempts,
    Instant failedAt)
    implements IntegrationEvent {
  public DeadLetterEvent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(occurredOn, "occurredOn must not be null");
    requireNonBlank(originalEventType, "originalEventType");
    Objects.requireNonNull(originalEventJson, "originalEventJson must not be null");
    Objects.requireNonNull(failureKind, "failureKind must not be null");
    Objects.requireNonNull(failedAt, "failedAt must not be null");
    errorMessage = errorMessage == null || errorMessage.isBlank() ? "no-message" : errorMessage;
  }

  /** Creates the dead letter; it is considered to occur at {@code failedAt}. */
  public static DeadLetterEvent of(
      IntegrationEvent originalEvent,
      String originalEventJson,
      String errorMessage,
      String stackTrace,
      FailureKind failureKind,
      int attempts,
      Instant failedAt) {
    Objects.requireNonNull(originalEvent, "originalEvent must not be null");
    return new DeadLetterEvent(
        UUID.randomUUID(),
        failedAt,
        EventTypeNames.qualified(originalEvent),
        originalEvent.id(),
        originalEventJson,
        errorMessage,
        stackTrace,
        failureKind,
        attempts,
        failedAt);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
