package com.servicescaffold.infra.eventbus.kafka;

import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.events.errors.PipelineException;
import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.infra.eventbus.IntegrationEventCallback;
import com.servicescaffold.infra.eventbus.contract.EventHeaders;
import com.servicescaffold.infra.eventbus.observability.EventBusTelemetry;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;

/**
 * Decodes the records of one subscription and hands them to its callback.
 *
 * <p>Every record is acknowledged exactly once: right away when it belongs to another event
 * type or cannot be decoded, otherwise when the stage returned by the callback completes.
 * Nothing is ever requeued.
 */
class SubscriptionMessageListener<T extends IntegrationEvent>
    implements AcknowledgingMessageListener<String, String> {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionMessageListener.class);

  private final String exchange;
  private final Class<T> eventType;
  private final String eventTypeName;
  private final String qualifiedTypeName;
  private final IntegrationEventJsonCodec codec;
  private final IntegrationEventCallback<T> callback;
  private final EventBusTelemetry telemetry;

  SubscriptionMessageListener(
      String exchange,
      Class<T> eventType,
      IntegrationEventJsonCodec codec,
      IntegrationEventCallback<T> callback,
      EventBusTelemetry telemetry) {
    this.exchange = exchange;
    this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
    this.eventTypeName = EventTypeNames.of(eventType);
    this.qualifiedTypeName = EventTypeNames.qualified(eventType);
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.callback = Objects.requireNonNull(callback, "callback must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  @Override
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
    long started = System.nanoTime();
    String typeFromHeader = headerValue(record.headers(), EventHeaders.X_EVENT_TYPE);
    if (typeFromHeader != null && !typeFromHeader.equals(qualifiedTypeName)) {
      telemetry.onSkipped(exchange, eventTypeName);
      acknowledgment.acknowledge();
      return;
    }

    T event;
    try {
      event = codec.decode(record.value(), eventType);
    } catch (PipelineException ex) {
      log.warn(
          "Dropping undeliverable message event_type={} partition={} offset={} reason={}",
          eventTypeName,
          record.partition(),
          record.offset(),
          ex.getMessage());
      telemetry.onDropped(exchange, eventTypeName, ex);
      acknowledgment.acknowledge();
      return;
    }

    telemetry.onDelivered(exchange, eventTypeName);
    CompletionStage<?> stage;
    try {
      stage = callback.onEvent(event);
    } catch (Exception ex) {
      log.error(
          "Event callback failed event_type={} event_id={}", eventTypeName, event.id(), ex);
      acknowledge(acknowledgment, started, ex);
      return;
    }

    if (stage == null) {
      acknowledge(acknowledgment, started, null);
      return;
    }
    stage.whenComplete(
        (ignored, throwable) -> {
          if (throwable != null) {
            log.warn(
                "Event processing ended with failure event_type={} event_id={} reason={}",
                eventTypeName,
                event.id(),
                throwable.getMessage());
          }
          acknowledge(acknowledgment, started, throwable);
        });
  }

  private void acknowledge(Acknowledgment acknowledgment, long started, Throwable error) {
    acknowledgment.acknowledge();
    telemetry.onAcknowledged(exchange, eventTypeName, System.nanoTime() - started, error);
  }

  private static String headerValue(Headers headers, String name) {
    if (headers == null) {
      return null;
    }
    Header header = headers.lastHeader(name);
    if (header == null || header.value() == null) {
      return null;
    }
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
