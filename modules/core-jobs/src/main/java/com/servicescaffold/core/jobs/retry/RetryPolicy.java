package com.servicescaffold.core.jobs.retry;

import java.time.Duration;

public interface RetryPolicy {
  int maxAttempts();

  /** Whether another attempt follows {@code attempt}, which just failed with {@code failure}. */
  boolean shouldRetry(int attempt, AttemptFailure failure);

  /** Delay to wait after {@code attempt} failed, before the next one starts. */
  Duration backoffForAttempt(int attempt);
}
