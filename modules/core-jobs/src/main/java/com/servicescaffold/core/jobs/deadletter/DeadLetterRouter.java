package com.servicescaffold.core.jobs.deadletter;

import com.servicescaffold.core.events.DeadLetterEvent;
import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.core.jobs.retry.AttemptFailure;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes permanently failed events to the dead-letter exchange, keyed by event type name.
 *
 * <p>Routing never throws: a failure to dead-letter is logged and reported through the return
 * value, since the source message is acknowledged either way.
 */
public class DeadLetterRouter {
  private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

  private final IntegrationEventBus eventBus;
  private final IntegrationEventJsonCodec codec;
  private final Clock clock;
  private final Duration publishTimeout;

  public DeadLetterRouter(
      IntegrationEventBus eventBus,
      IntegrationEventJsonCodec codec,
      Clock clock,
      Duration publishTimeout) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.publishTimeout =
        Objects.requireNonNull(publishTimeout, "publishTimeout must not be null");
  }

  public boolean route(IntegrationEvent original, AttemptFailure failure, int attempts) {
    Objects.requireNonNull(original, "original must not be null");
    Objects.requireNonNull(failure, "failure must not be null");
    String eventType = EventTypeNames.of(original);

    try {
      DeadLetterEvent deadLetter =
          DeadLetterEvent.of(
              original,
              codec.encode(original),
              failure.message(),
              stackTraceOf(failure.error()),
              failure.kind(),
              attempts,
              clock.instant());
      eventBus
          .publishDeadLetter(deadLetter, eventType)
          .get(Math.max(1L, publishTimeout.toMillis()), TimeUnit.MILLISECONDS);

      log.warn(
          "Dead-lettered event event_type={} event_id={} attempts={} failure_kind={} dead_letter_id={}",
          eventType,
          original.id(),
          attempts,
          failure.kind(),
          deadLetter.id());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error(
          "Interrupted while dead-lettering event_type={} event_id={}",
          eventType,
          original.id(),
          ex);
    } catch (ExecutionException ex) {
      log.error(
          "Failed to dead-letter event_type={} event_id={}",
          eventType,
          original.id(),
          ex.getCause() == null ? ex : ex.getCause());
    } catch (TimeoutException ex) {
      log.error(
          "Timed out dead-lettering event_type={} event_id={} timeout_ms={}",
          eventType,
          original.id(),
          publishTimeout.toMillis());
    } catch (RuntimeException ex) {
      log.error(
          "Failed to dead-letter event_type={} event_id={}", eventType, original.id(), ex);
    }
    return false;
  }

  private static String stackTraceOf(Throwable error) {
    if (error == null) {
      return null;
    }
    StringWriter buffer = new StringWriter();
    error.printStackTrace(new PrintWriter(buffer));
    return buffer.toString();
  }
}
