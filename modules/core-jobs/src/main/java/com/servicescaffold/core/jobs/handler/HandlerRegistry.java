package com.servicescaffold.core.jobs.handler;

import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/** Immutable map from fully qualified event type name to the handler registered for it. */
public final class HandlerRegistry {
  private final Map<String, HandlerRegistration<?>> registrations;

  private HandlerRegistry(Map<String, HandlerRegistration<?>> registrations) {
    this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static HandlerRegistry empty() {
    return new HandlerRegistry(Map.of());
  }

  public Optional<HandlerRegistration<?>> find(String qualifiedTypeName) {
    return Optional.ofNullable(registrations.get(qualifiedTypeName));
  }

  public Optional<HandlerRegistration<?>> find(Class<? extends IntegrationEvent> eventType) {
    return find(EventTypeNames.qualified(eventType))
        .filter(registration -> registration.eventType() == eventType);
  }

  public Set<Class<? extends IntegrationEvent>> eventTypes() {
    Set<Class<? extends IntegrationEvent>> eventTypes = new LinkedHashSet<>();
    for (HandlerRegistration<?> registration : registrations.values()) {
      eventTypes.add(registration.eventType());
    }
    return Collections.unmodifiableSet(eventTypes);
  }

  public int size() {
    return registrations.size();
  }

  public static final class Builder {
    private final Map<String, HandlerRegistration<?>> registrations = new LinkedHashMap<>();

    private Builder() {}

    public <T extends IntegrationEvent> Builder register(
        Class<T> eventType, BackgroundJobHandler<T> handler) {
      Objects.requireNonNull(handler, "handler must not be null");
      return register(eventType, () -> handler);
    }

    public <T extends IntegrationEvent> Builder register(
        Class<T> eventType, Supplier<? extends BackgroundJobHandler<T>> handlerSupplier) {
      HandlerRegistration<T> registration = new HandlerRegistration<>(eventType, handlerSupplier);
      String name = EventTypeNames.qualified(eventType);
      if (registrations.containsKey(name)) {
        throw new IllegalStateException("Duplicate background job handler for event type " + name);
      }
      registrations.put(name, registration);
      return this;
    }

    public HandlerRegistry build() {
      return new HandlerRegistry(registrations);
    }
  }
}
