package com.servicescaffold.core.jobs.handler;

import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import java.util.Objects;
import java.util.function.Supplier;

public final class HandlerRegistration<T extends IntegrationEvent> {
  private final Class<T> eventType;
  private final Supplier<? extends BackgroundJobHandler<T>> handlerSupplier;

  HandlerRegistration(
      Class<T> eventType, Supplier<? extends BackgroundJobHandler<T>> handlerSupplier) {
    this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
    this.handlerSupplier =
        Objects.requireNonNull(handlerSupplier, "handlerSupplier must not be null");
  }

  public Class<T> eventType() {
    return eventType;
  }

  public String eventTypeName() {
    return EventTypeNames.of(eventType);
  }

  public boolean supports(IntegrationEvent event) {
    return eventType.isInstance(event);
  }

  /** Resolves a handler instance; prototype-scoped handlers yield a fresh one per call. */
  public Invocation resolve() {
    BackgroundJobHandler<T> handler = handlerSupplier.get();
    if (handler == null) {
      throw new IllegalStateException("Handler supplier returned null for " + eventTypeName());
    }
    return event -> handler.handle(eventType.cast(event));
  }

  @FunctionalInterface
  public interface Invocation {
    void invoke(IntegrationEvent event) throws Exception;
  }
}
