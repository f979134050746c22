package com.servicescaffold.core.jobs.metrics;

import com.servicescaffold.core.events.FailureKind;
import java.time.Duration;
import java.util.List;

/** Per-event-type job counters. Implementations must be safe for concurrent use. */
public interface JobMetrics {
  String REASON_HANDLER_NOT_FOUND = "handler_not_found";
  String REASON_EXHAUSTED = "exhausted";
  String REASON_CANCELLED = "cancelled";

  void jobStarted(String eventType);

  void jobCompleted(String eventType, Duration duration);

  void jobFailed(String eventType, String reason);

  void jobRetried(String eventType, FailureKind failureKind);

  void jobDeadLettered(String eventType);

  List<JobTypeStats> snapshot();
}
