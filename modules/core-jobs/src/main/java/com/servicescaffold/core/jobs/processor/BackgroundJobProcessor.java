package com.servicescaffold.core.jobs.processor;

import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.FailureKind;
import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.events.errors.PipelineErrorKind;
import com.servicescaffold.core.events.errors.PipelineException;
import com.servicescaffold.core.jobs.deadletter.DeadLetterRouter;
import com.servicescaffold.core.jobs.handler.HandlerRegistration;
import com.servicescaffold.core.jobs.handler.HandlerRegistry;
import com.servicescaffold.core.jobs.metrics.JobMetrics;
import com.servicescaffold.core.jobs.retry.AttemptFailure;
import com.servicescaffold.core.jobs.retry.RetryExecutor;
import com.servicescaffold.core.jobs.retry.RetryOutcome;
import com.servicescaffold.core.jobs.retry.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs background jobs: resolves the handler for an event, retries it under the configured
 * policy and routes exhausted or cancelled jobs to the dead-letter exchange.
 *
 * <p>Outcomes per job: completed; {@code HANDLER_NOT_FOUND} (not dead-lettered); {@code
 * JOB_FAILED} after the last attempt failed; {@code CANCELLED} when the job thread was
 * interrupted. The last two are dead-lettered before the exception is raised.
 */
public class BackgroundJobProcessor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackgroundJobProcessor.class);

  private final HandlerRegistry registry;
  private final RetryExecutor retryExecutor;
  private final RetryPolicy retryPolicy;
  private final Duration attemptTimeout;
  private final DeadLetterRouter deadLetterRouter;
  private final JobMetrics metrics;
  private final ExecutorService jobExecutor;
  private final Duration shutdownGracePeriod;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public BackgroundJobProcessor(
      HandlerRegistry registry,
      RetryExecutor retryExecutor,
      RetryPolicy retryPolicy,
      Duration attemptTimeout,
      DeadLetterRouter deadLetterRouter,
      JobMetrics metrics,
      ExecutorService jobExecutor,
      Duration shutdownGracePeriod) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    this.attemptTimeout =
        Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");
    this.deadLetterRouter =
        Objects.requireNonNull(deadLetterRouter, "deadLetterRouter must not be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor must not be null");
    this.shutdownGracePeriod =
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod must not be null");
  }

  /**
   * Schedules the job for {@code event} and returns immediately. Cancelling the returned future
   * interrupts the job, which then ends as {@code CANCELLED}.
   */
  public <T extends IntegrationEvent> CompletableFuture<JobResult> process(T event) {
    Objects.requireNonNull(event, "event must not be null");
    CompletableFuture<JobResult> result = new CompletableFuture<>();
    if (closed.get()) {
      result.completeExceptionally(shutDown(event, null));
      return result;
    }

    Future<?> task;
    try {
      task =
          jobExecutor.submit(
              () -> {
                try {
                  result.complete(execute(event));
                } catch (Throwable ex) {
                  result.completeExceptionally(ex);
                }
              });
    } catch (RejectedExecutionException ex) {
      result.completeExceptionally(shutDown(event, ex));
      return result;
    }

    result.whenComplete(
        (ignored, throwable) -> {
          if (result.isCancelled()) {
            task.cancel(true);
          }
        });
    return result;
  }

  /** Runs the job on the calling thread. Interrupting that thread cancels the job. */
  public JobResult execute(IntegrationEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    String eventType = EventTypeNames.of(event);
    long started = System.nanoTime();
    metrics.jobStarted(eventType);

    HandlerRegistration.Invocation handler = resolveHandler(event, eventType);
    log.info("Starting background job event_type={} event_id={}", eventType, event.id());

    RetryOutcome<Void> outcome =
        retryExecutor.execute(
            eventType + ":" + event.id(),
            () -> {
              handler.invoke(event);
              return null;
            },
            retryPolicy,
            attemptTimeout,
            (failure, delay) -> metrics.jobRetried(eventType, failure.kind()));
    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

    if (outcome.isSuccess()) {
      metrics.jobCompleted(eventType, elapsed);
      log.info(
          "Completed background job event_type={} event_id={} attempts={} elapsed_ms={}",
          eventType,
          event.id(),
          outcome.attempts(),
          elapsed.toMillis());
      return new JobResult(event.id(), eventType, outcome.attempts(), elapsed);
    }

    AttemptFailure lastFailure = outcome.lastFailure();
    if (outcome.status() == RetryOutcome.Status.CANCELLED) {
      metrics.jobFailed(eventType, JobMetrics.REASON_CANCELLED);
      deadLetter(event, eventType, lastFailure, outcome.attempts());
      log.warn(
          "Cancelled background job event_type={} event_id={} attempts={}",
          eventType,
          event.id(),
          outcome.attempts());
      throw new PipelineException(
          PipelineErrorKind.CANCELLED,
          eventType,
          FailureKind.CANCELLED,
          "Job " + eventType + " was cancelled after " + outcome.attempts() + " attempt(s)",
          lastFailure.error());
    }

    metrics.jobFailed(eventType, JobMetrics.REASON_EXHAUSTED);
    deadLetter(event, eventType, lastFailure, outcome.attempts());
    log.error(
        "Background job failed event_type={} event_id={} attempts={} failure_kind={}",
        eventType,
        event.id(),
        outcome.attempts(),
        lastFailure.kind(),
        lastFailure.error());
    throw new PipelineException(
        PipelineErrorKind.JOB_FAILED,
        eventType,
        lastFailure.kind(),
        "Job "
            + eventType
            + " failed after "
            + outcome.attempts()
            + " attempt(s): "
            + lastFailure.message(),
        lastFailure.error());
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Stops accepting jobs and waits up to the grace period for running ones. Jobs still running
   * afterwards are interrupted and end as {@code CANCELLED}.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    jobExecutor.shutdown();
    try {
      if (!jobExecutor.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
        int pending = jobExecutor.shutdownNow().size();
        log.warn(
            "Interrupted background jobs after grace period grace_ms={} queued={}",
            shutdownGracePeriod.toMillis(),
            pending);
      }
    } catch (InterruptedException ex) {
      jobExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private HandlerRegistration.Invocation resolveHandler(IntegrationEvent event, String eventType) {
    HandlerRegistration<?> registration =
        registry
            .find(EventTypeNames.qualified(event))
            .filter(candidate -> candidate.supports(event))
            .orElse(null);
    if (registration == null) {
      log.error("No handler registered event_type={} event_id={}", eventType, event.id());
      metrics.jobFailed(eventType, JobMetrics.REASON_HANDLER_NOT_FOUND);
      throw new PipelineException(
          PipelineErrorKind.HANDLER_NOT_FOUND,
          eventType,
          null,
          "No background job handler registered for event type " + eventType,
          null);
    }
    try {
      return registration.resolve();
    } catch (RuntimeException ex) {
      log.error("Failed to resolve handler event_type={} event_id={}", eventType, event.id(), ex);
      metrics.jobFailed(eventType, JobMetrics.REASON_HANDLER_NOT_FOUND);
      throw new PipelineException(
          PipelineErrorKind.HANDLER_NOT_FOUND,
          eventType,
          null,
          "Failed to resolve background job handler for event type " + eventType,
          ex);
    }
  }

  private void deadLetter(
      IntegrationEvent event, String eventType, AttemptFailure failure, int attempts) {
    // Publishing must not see the job's own cancellation.
    boolean interrupted = Thread.interrupted();
    try {
      if (deadLetterRouter.route(event, failure, attempts)) {
        metrics.jobDeadLettered(eventType);
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static PipelineException shutDown(IntegrationEvent event, Throwable cause) {
    return new PipelineException(
        PipelineErrorKind.CANCELLED,
        EventTypeNames.of(event),
        FailureKind.CANCELLED,
        "Background job processor is shut down",
        cause);
  }
}
