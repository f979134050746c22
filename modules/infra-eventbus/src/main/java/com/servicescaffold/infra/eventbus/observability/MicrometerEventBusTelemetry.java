package com.servicescaffold.infra.eventbus.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public class MicrometerEventBusTelemetry implements EventBusTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerEventBusTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void onPublishSuccess(String exchange, String eventType, long durationNanos) {
    Counter.builder("infra.eventbus.publish.total")
        .description("Integration events published by outcome")
        .tag("exchange", safeValue(exchange))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.eventbus.publish.duration")
        .description("Latency until the broker confirmed a publish")
        .tag("exchange", safeValue(exchange))
        .tag("event_type", safeValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String exchange, String eventType, Throwable error) {
    Counter.builder("infra.eventbus.publish.total")
        .description("Integration events published by outcome")
        .tag("exchange", safeValue(exchange))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDelivered(String exchange, String eventType) {
    consumeCounter(exchange, eventType, "delivered", null).increment();
  }

  @Override
  public void onSkipped(String exchange, String eventType) {
    consumeCounter(exchange, eventType, "skipped", null).increment();
  }

  @Override
  public void onDropped(String exchange, String eventType, Throwable error) {
    consumeCounter(exchange, eventType, "dropped", error).increment();
  }

  @Override
  public void onAcknowledged(
      String exchange, String eventType, long durationNanos, Throwable error) {
    Timer.builder("infra.eventbus.consume.duration")
        .description("Time from delivery to acknowledgment")
        .tag("exchange", safeValue(exchange))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", error == null ? "success" : "failure")
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  private Counter consumeCounter(
      String exchange, String eventType, String outcome, Throwable error) {
    return Counter.builder("infra.eventbus.consume.total")
        .description("Integration events received by outcome")
        .tag("exchange", safeValue(exchange))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", outcome)
        .tag("error", safeError(error))
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
