package com.servicescaffold.core.events.errors;

import com.servicescaffold.core.events.FailureKind;
import java.util.Objects;

public class PipelineException extends RuntimeException {
  private final PipelineErrorKind kind;
  private final String eventType;
  private final FailureKind failureKind;

  public PipelineException(PipelineErrorKind kind, String message) {
    this(kind, null, null, message, null);
  }

  public PipelineException(PipelineErrorKind kind, String message, Throwable cause) {
    this(kind, null, null, message, cause);
  }

  public PipelineException(
      PipelineErrorKind kind,
      String eventType,
      FailureKind failureKind,
      String message,
      Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    this.eventType = eventType;
    this.failureKind = failureKind;
  }

  public PipelineErrorKind getKind() {
    return kind;
  }

  public int getStatusCode() {
    return kind.statusCode();
  }

  /** Event type name the failure relates to, or {@code null} for bus-level failures. */
  public String getEventType() {
    return eventType;
  }

  /** Kind of the last attempt failure for {@code JOB_FAILED} and {@code CANCELLED}. */
  public FailureKind getFailureKind() {
    return failureKind;
  }
}
