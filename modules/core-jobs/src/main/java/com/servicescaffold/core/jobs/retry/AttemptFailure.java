package com.servicescaffold.core.jobs.retry;

import com.servicescaffold.core.events.FailureKind;
import java.util.Objects;

public record AttemptFailure(int attempt, FailureKind kind, Throwable error) {
  public AttemptFailure {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(error, "error must not be null");
  }

  public String message() {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
