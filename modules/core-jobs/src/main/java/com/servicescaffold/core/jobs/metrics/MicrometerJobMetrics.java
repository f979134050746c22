package com.servicescaffold.core.jobs.metrics;

import com.servicescaffold.core.events.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

public class MicrometerJobMetrics implements JobMetrics {
  static final String STARTED = "core.jobs.started";
  static final String COMPLETED = "core.jobs.completed";
  static final String FAILED = "core.jobs.failed";
  static final String RETRIES = "core.jobs.retries";
  static final String DEADLETTERED = "core.jobs.deadlettered";
  static final String DURATION = "core.jobs.duration";
  private static final String EVENT_TYPE_TAG = "event_type";

  private final MeterRegistry meterRegistry;

  public MicrometerJobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void jobStarted(String eventType) {
    Counter.builder(STARTED)
        .description("Background jobs started")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void jobCompleted(String eventType, Duration duration) {
    Counter.builder(COMPLETED)
        .description("Background jobs completed successfully")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .register(meterRegistry)
        .increment();

    Timer.builder(DURATION)
        .description("Duration of successful background jobs, retries included")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, duration.toNanos()), TimeUnit.NANOSECONDS);
  }

  @Override
  public void jobFailed(String eventType, String reason) {
    Counter.builder(FAILED)
        .description("Background jobs that did not complete")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .tag("reason", safeValue(reason))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void jobRetried(String eventType, FailureKind failureKind) {
    Counter.builder(RETRIES)
        .description("Retries scheduled for background jobs")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .tag("failure_kind", failureKind == null ? "unknown" : failureKind.name())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void jobDeadLettered(String eventType) {
    Counter.builder(DEADLETTERED)
        .description("Background jobs routed to the dead-letter exchange")
        .tag(EVENT_TYPE_TAG, safeValue(eventType))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public List<JobTypeStats> snapshot() {
    TreeSet<String> eventTypes = new TreeSet<>();
    meterRegistry
        .find(STARTED)
        .counters()
        .forEach(counter -> eventTypes.add(counter.getId().getTag(EVENT_TYPE_TAG)));

    List<JobTypeStats> stats = new ArrayList<>();
    for (String eventType : eventTypes) {
      Timer timer = meterRegistry.find(DURATION).tag(EVENT_TYPE_TAG, eventType).timer();
      stats.add(
          new JobTypeStats(
              eventType,
              count(STARTED, eventType),
              count(COMPLETED, eventType),
              count(FAILED, eventType),
              count(RETRIES, eventType),
              count(DEADLETTERED, eventType),
              timer == null ? 0.0d : timer.mean(TimeUnit.MILLISECONDS)));
    }
    return stats;
  }

  private long count(String meterName, String eventType) {
    Collection<Counter> counters =
        meterRegistry.find(meterName).tag(EVENT_TYPE_TAG, eventType).counters();
    double total = 0.0d;
    for (Counter counter : counters) {
      total += counter.count();
    }
    return (long) total;
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
