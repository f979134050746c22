package com.servicescaffold.core.events;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact published for consumption by other processes.
 *
 * <p>Implementations are immutable. The identifier is assigned once when the event is created
 * and the occurrence timestamp is UTC; both are carried unchanged through the wire format.
 */
public interface IntegrationEvent {
  UUID id();

  Instant occurredOn();
}
