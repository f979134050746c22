package com.servicescaffold.core.jobs.retry;

import java.time.Duration;
import java.util.Objects;

/** Waits {@code baseDelay * 2^(attempt-1)} after a failed attempt, never more than {@code maxDelay}. */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private static final double MULTIPLIER = 2.0d;

  private final int maxAttempts;
  private final Duration baseDelay;
  private final Duration maxDelay;

  public ExponentialBackoffRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public boolean shouldRetry(int attempt, AttemptFailure failure) {
    return attempt < maxAttempts;
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    long baseMillis = Math.max(0L, baseDelay.toMillis());
    long maxMillis = Math.max(baseMillis, maxDelay.toMillis());
    if (baseMillis == 0L) {
      return Duration.ZERO;
    }

    int exponent = Math.max(0, attempt - 1);
    double scaled = baseMillis * Math.pow(MULTIPLIER, exponent);
    long bounded = (long) Math.min(maxMillis, scaled);
    return Duration.ofMillis(Math.max(0L, bounded));
  }
}
