package com.servicescaffold.core.jobs.handler;

import com.servicescaffold.core.events.IntegrationEvent;

/**
 * Performs the background work for one event type.
 *
 * <p>Delivery is at-least-once, so the same event can reach a handler more than once and
 * implementations must be idempotent. A handler that throws is retried. Attempts that exceed
 * the configured timeout are interrupted; long-running handlers should check the interrupt
 * flag and stop.
 */
@FunctionalInterface
public interface BackgroundJobHandler<T extends IntegrationEvent> {
  void handle(T event) throws Exception;
}
