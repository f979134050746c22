package com.servicescaffold.core.jobs.retry;

import java.util.Objects;

public record RetryOutcome<T>(Status status, T value, int attempts, AttemptFailure lastFailure) {
  public enum Status {
    SUCCEEDED,
    EXHAUSTED,
    CANCELLED
  }

  public RetryOutcome {
    Objects.requireNonNull(status, "status must not be null");
    if (status != Status.SUCCEEDED) {
      Objects.requireNonNull(lastFailure, "lastFailure must not be null");
    }
  }

  public static <T> RetryOutcome<T> succeeded(T value, int attempts) {
    return new RetryOutcome<>(Status.SUCCEEDED, value, attempts, null);
  }

  public static <T> RetryOutcome<T> exhausted(int attempts, AttemptFailure lastFailure) {
    return new RetryOutcome<>(Status.EXHAUSTED, null, attempts, lastFailure);
  }

  public static <T> RetryOutcome<T> cancelled(int attempts, AttemptFailure lastFailure) {
    return new RetryOutcome<>(Status.CANCELLED, null, attempts, lastFailure);
  }

  public boolean isSuccess() {
    return status == Status.SUCCEEDED;
  }
}
