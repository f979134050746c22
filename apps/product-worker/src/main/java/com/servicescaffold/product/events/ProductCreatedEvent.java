package com.servicescaffold.product.events;

import com.servicescaffold.core.events.IntegrationEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Published by the product service once a product has been persisted. */
public record ProductCreatedEvent(UUID id, Instant occurredOn, String name, BigDecimal price)
    implements IntegrationEvent {
  public ProductCreatedEvent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(occurredOn, "occurredOn must not be null");
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    Objects.requireNonNull(price, "price must not be null");
    if (price.signum() < 0) {
      throw new IllegalArgumentException("price must not be negative");
    }
  }

  public static ProductCreatedEvent of(String name, BigDecimal price) {
    return new ProductCreatedEvent(UUID.randomUUID(), Instant.now(), name, price);
  }
}
