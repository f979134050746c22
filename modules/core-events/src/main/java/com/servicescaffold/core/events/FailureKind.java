package com.servicescaffold.core.events;

public enum FailureKind {
  ERROR,
  TIMEOUT_EXCEEDED,
  CANCELLED
}
