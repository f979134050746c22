package com.servicescaffold.infra.eventbus.observability;

public interface EventBusTelemetry {
  void onPublishSuccess(String exchange, String eventType, long durationNanos);

  void onPublishFailure(String exchange, String eventType, Throwable error);

  void onDelivered(String exchange, String eventType);

  void onSkipped(String exchange, String eventType);

  void onDropped(String exchange, String eventType, Throwable error);

  void onAcknowledged(String exchange, String eventType, long durationNanos, Throwable error);
}
