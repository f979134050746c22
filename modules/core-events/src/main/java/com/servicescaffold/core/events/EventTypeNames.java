package com.servicescaffold.core.events;

import java.util.Objects;

public final class EventTypeNames {
  private EventTypeNames() {}

  /** Short type name used for routing keys, consumer groups, metric tags and logs. */
  public static String of(Class<?> eventType) {
    Objects.requireNonNull(eventType, "eventType must not be null");
    return eventType.getSimpleName();
  }

  public static String of(IntegrationEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    return of(event.getClass());
  }

  /**
   * Fully qualified type name carried in the event-type header and used as the handler key, so
   * two events with the same simple name in different packages stay distinct.
   */
  public static String qualified(Class<?> eventType) {
    Objects.requireNonNull(eventType, "eventType must not be null");
    return eventType.getName();
  }

  public static String qualified(IntegrationEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    return qualified(event.getClass());
  }
}
