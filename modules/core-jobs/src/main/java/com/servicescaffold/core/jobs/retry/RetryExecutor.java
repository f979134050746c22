package com.servicescaffold.core.jobs.retry;

import com.servicescaffold.core.events.FailureKind;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a unit of work up to {@link RetryPolicy#maxAttempts()} times with a timeout per attempt.
 *
 * <p>Attempts run on {@code attemptExecutor} while the calling thread waits, so a timed-out
 * attempt can be abandoned and interrupted. Interrupting the calling thread cancels the whole
 * run: the current attempt is interrupted or the backoff is cut short, and the outcome is
 * {@link RetryOutcome.Status#CANCELLED}. The interrupt flag stays set for the caller.
 */
public class RetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private final ExecutorService attemptExecutor;
  private final Sleeper sleeper;

  public RetryExecutor(ExecutorService attemptExecutor) {
    this(attemptExecutor, duration -> Thread.sleep(duration.toMillis()));
  }

  public RetryExecutor(ExecutorService attemptExecutor, Sleeper sleeper) {
    this.attemptExecutor =
        Objects.requireNonNull(attemptExecutor, "attemptExecutor must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> RetryOutcome<T> execute(
      String operationName,
      Callable<T> work,
      RetryPolicy policy,
      Duration attemptTimeout,
      RetryListener listener) {
    Objects.requireNonNull(work, "work must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    RetryListener effectiveListener = listener == null ? RetryListener.NONE : listener;

    int attempt = 1;
    while (true) {
      AttemptResult<T> result = runAttempt(attempt, work, attemptTimeout);
      if (result.failure == null) {
        return RetryOutcome.succeeded(result.value, attempt);
      }

      AttemptFailure failure = result.failure;
      if (failure.kind() == FailureKind.CANCELLED) {
        return RetryOutcome.cancelled(attempt, failure);
      }
      if (attempt >= policy.maxAttempts() || !policy.shouldRetry(attempt, failure)) {
        return RetryOutcome.exhausted(attempt, failure);
      }

      Duration delay = policy.backoffForAttempt(attempt);
      log.warn(
          "Retrying operation={} attempt={} max_attempts={} delay_ms={} failure_kind={} error={}",
          operationName,
          attempt,
          policy.maxAttempts(),
          delay.toMillis(),
          failure.kind(),
          failure.message());
      effectiveListener.onRetryScheduled(failure, delay);

      if (!sleep(delay)) {
        return RetryOutcome.cancelled(
            attempt,
            new AttemptFailure(
                attempt,
                FailureKind.CANCELLED,
                new CancellationException("Interrupted during retry backoff")));
      }
      attempt++;
    }
  }

  private <T> AttemptResult<T> runAttempt(int attempt, Callable<T> work, Duration timeout) {
    if (Thread.currentThread().isInterrupted()) {
      return AttemptResult.failed(
          attempt, FailureKind.CANCELLED, new CancellationException("Cancelled before attempt"));
    }

    Future<T> future;
    try {
      future = attemptExecutor.submit(work);
    } catch (RejectedExecutionException ex) {
      return AttemptResult.failed(attempt, FailureKind.CANCELLED, ex);
    }

    try {
      T value =
          isBounded(timeout)
              ? future.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
              : future.get();
      return AttemptResult.succeeded(value);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return AttemptResult.failed(attempt, FailureKind.ERROR, cause);
    } catch (TimeoutException ex) {
      future.cancel(true);
      TimeoutException timedOut =
          new TimeoutException("Attempt timed out after " + timeout.toMillis() + " ms");
      return AttemptResult.failed(attempt, FailureKind.TIMEOUT_EXCEEDED, timedOut);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return AttemptResult.failed(attempt, FailureKind.CANCELLED, ex);
    } catch (CancellationException ex) {
      return AttemptResult.failed(attempt, FailureKind.CANCELLED, ex);
    }
  }

  private boolean sleep(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return !Thread.currentThread().isInterrupted();
    }
    try {
      sleeper.sleep(delay);
      return true;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static boolean isBounded(Duration timeout) {
    return timeout != null && !timeout.isZero() && !timeout.isNegative();
  }

  private static final class AttemptResult<T> {
    private final T value;
    private final AttemptFailure failure;

    private AttemptResult(T value, AttemptFailure failure) {
      this.value = value;
      this.failure = failure;
    }

    static <T> AttemptResult<T> succeeded(T value) {
      return new AttemptResult<>(value, null);
    }

    static <T> AttemptResult<T> failed(int attempt, FailureKind kind, Throwable error) {
      return new AttemptResult<>(null, new AttemptFailure(attempt, kind, error));
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
