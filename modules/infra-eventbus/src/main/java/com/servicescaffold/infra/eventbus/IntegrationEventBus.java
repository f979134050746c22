package com.servicescaffold.infra.eventbus;

import com.servicescaffold.core.events.DeadLetterEvent;
import com.servicescaffold.core.events.IntegrationEvent;
import java.util.concurrent.CompletableFuture;

/**
 * Transport for integration events between processes.
 *
 * <p>Published events go to a single fan-out exchange: every subscription receives every
 * message, delivery is at-least-once and nothing is deduplicated. Dead letters go to a separate
 * exchange where the routing key is significant.
 */
public interface IntegrationEventBus extends AutoCloseable {
  /**
   * Declares the exchanges. Calling it again after a successful initialization does nothing.
   *
   * @throws com.servicescaffold.core.events.errors.PipelineException of kind {@code CONNECTION}
   *     when the broker cannot be reached
   */
  void initialize();

  boolean isInitialized();

  CompletableFuture<Void> publish(IntegrationEvent event);

  CompletableFuture<Void> publishDeadLetter(DeadLetterEvent event, String routingKey);

  /**
   * Binds a new exclusive subscription for {@code eventType}. Each delivered message is
   * acknowledged once the stage returned by the callback completes, whatever its outcome.
   */
  <T extends IntegrationEvent> EventSubscription subscribe(
      Class<T> eventType, IntegrationEventCallback<T> callback);

  @Override
  void close();
}
