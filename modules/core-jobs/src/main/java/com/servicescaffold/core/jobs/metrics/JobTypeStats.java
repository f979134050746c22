package com.servicescaffold.core.jobs.metrics;

public record JobTypeStats(
    String eventType,
    long started,
    long completed,
    long failed,
    long retries,
    long deadLettered,
    double meanDurationMs) {}
