package com.servicescaffold.core.jobs.metrics;

import com.servicescaffold.core.events.FailureKind;
import java.time.Duration;
import java.util.List;

public class NoOpJobMetrics implements JobMetrics {
  @Override
  public void jobStarted(String eventType) {}

  @Override
  public void jobCompleted(String eventType, Duration duration) {}

  @Override
  public void jobFailed(String eventType, String reason) {}

  @Override
  public void jobRetried(String eventType, FailureKind failureKind) {}

  @Override
  public void jobDeadLettered(String eventType) {}

  @Override
  public List<JobTypeStats> snapshot() {
    return List.of();
  }
}
