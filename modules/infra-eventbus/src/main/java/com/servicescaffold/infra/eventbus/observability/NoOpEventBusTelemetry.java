package com.servicescaffold.infra.eventbus.observability;

public class NoOpEventBusTelemetry implements EventBusTelemetry {
    @Override
    public void onPublishSuccess(String exchange, String eventType, long durationNanos) {
    }

    @Override
    public void onPublishFailure(String exchange, String eventType, Throwable error) {
    }

    @Override
    public void onDelivered(String exchange, String eventType) {
    }

    @Override
    public void onSkipped(String exchange, String eventType) {
    }

    @Override
    public void onDropped(String exchange, String eventType, Throwable error) {
    }

    @Override
    public void onAcknowledged(String exchange, String eventType, long durationNanos, Throwable error) {
    }
}
