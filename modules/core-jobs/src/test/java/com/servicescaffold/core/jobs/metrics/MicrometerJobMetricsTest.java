package com.servicescaffold.core.jobs.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.servicescaffold.core.events.FailureKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class MicrometerJobMetricsTest {
  @Test
  void shouldCountJobLifecyclePerEventType() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerJobMetrics metrics = new MicrometerJobMetrics(registry);

    metrics.jobStarted("SendEmailEvent");
    metrics.jobStarted("SendEmailEvent");
    metrics.jobRetried("SendEmailEvent", FailureKind.TIMEOUT_EXCEEDED);
    metrics.jobCompleted("SendEmailEvent", Duration.ofMillis(120));
    metrics.jobFailed("SendEmailEvent", JobMetrics.REASON_EXHAUSTED);
    metrics.jobDeadLettered("SendEmailEvent");

    assertEquals(
        2.0d,
        registry.get("core.jobs.started").tag("event_type", "SendEmailEvent").counter().count());
    assertEquals(
        1.0d,
        registry
            .get("core.jobs.retries")
            .tag("failure_kind", "TIMEOUT_EXCEEDED")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry.get("core.jobs.failed").tag("reason", "exhausted").counter().count());
    assertEquals(1.0d, registry.get("core.jobs.deadlettered").counter().count());
    assertEquals(1L, registry.get("core.jobs.duration").timer().count());
  }

  @Test
  void shouldSummariseEachEventTypeInSnapshot() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerJobMetrics metrics = new MicrometerJobMetrics(registry);

    metrics.jobStarted("SendEmailEvent");
    metrics.jobCompleted("SendEmailEvent", Duration.ofMillis(40));
    metrics.jobStarted("ProductCreatedEvent");
    metrics.jobFailed("ProductCreatedEvent", JobMetrics.REASON_HANDLER_NOT_FOUND);
    metrics.jobStarted("ProductCreatedEvent");
    metrics.jobFailed("ProductCreatedEvent", JobMetrics.REASON_CANCELLED);

    List<JobTypeStats> snapshot = metrics.snapshot();

    assertEquals(2, snapshot.size());
    JobTypeStats product = snapshot.get(0);
    assertEquals("ProductCreatedEvent", product.eventType());
    assertEquals(2L, product.started());
    assertEquals(2L, product.failed());
    assertEquals(0L, product.completed());
    JobTypeStats email = snapshot.get(1);
    assertEquals(1L, email.completed());
    assertEquals(40.0d, email.meanDurationMs(), 0.001d);
  }
}
