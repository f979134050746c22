package com.servicescaffold.core.jobs.retry;

import java.time.Duration;

@FunctionalInterface
public interface RetryListener {
  RetryListener NONE = (failure, delay) -> {};

  /** Called once per retry that is actually going to happen, before the backoff starts. */
  void onRetryScheduled(AttemptFailure failure, Duration delay);
}
