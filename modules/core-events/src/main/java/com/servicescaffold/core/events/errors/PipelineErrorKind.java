package com.servicescaffold.core.events.errors;

/**
 * Failure categories of the event pipeline. The status code is what a boundary (for example an
 * HTTP exception mapper) reports for the kind.
 */
public enum PipelineErrorKind {
  NOT_INITIALIZED(503, false),
  CONNECTION(503, false),
  CONFIGURATION(500, false),
  PUBLISH(502, true),
  SERIALIZATION(500, false),
  DESERIALIZATION(400, false),
  HANDLER_NOT_FOUND(500, false),
  JOB_FAILED(500, false),
  CANCELLED(503, true);

  private final int statusCode;
  private final boolean transientFailure;

  PipelineErrorKind(int statusCode, boolean transientFailure) {
    this.statusCode = statusCode;
    this.transientFailure = transientFailure;
  }

  public int statusCode() {
    return statusCode;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
