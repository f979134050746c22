package com.servicescaffold.product.events;

import com.servicescaffold.core.events.IntegrationEvent;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record SendEmailEvent(
    UUID id, Instant occurredOn, String to, String subject, String body, boolean html)
    implements IntegrationEvent {
  public SendEmailEvent {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(occurredOn, "occurredOn must not be null");
    if (to == null || to.isBlank()) {
      throw new IllegalArgumentException("to must not be blank");
    }
    subject = subject == null ? "" : subject;
    body = body == null ? "" : body;
  }

  public static SendEmailEvent of(String to, String subject, String body) {
    return new SendEmailEvent(UUID.randomUUID(), Instant.now(), to, subject, body, true);
  }
}
