package com.servicescaffold.core.jobs.deadletter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.servicescaffold.core.events.DeadLetterEvent;
import com.servicescaffold.core.events.FailureKind;
import com.servicescaffold.core.events.errors.PipelineErrorKind;
import com.servicescaffold.core.events.errors.PipelineException;
import com.servicescaffold.core.events.serde.EventObjectMapperFactory;
import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.core.jobs.OrderShippedEvent;
import com.servicescaffold.core.jobs.RecordingEventBus;
import com.servicescaffold.core.jobs.retry.AttemptFailure;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class DeadLetterRouterTest {
  private static final Instant NOW = Instant.parse("2026-03-02T08:15:30Z");

  private final IntegrationEventJsonCodec codec =
      new IntegrationEventJsonCodec(EventObjectMapperFactory.create());
  private final RecordingEventBus eventBus = new RecordingEventBus();
  private final DeadLetterRouter router =
      new DeadLetterRouter(
          eventBus, codec, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMillis(200));

  @Test
  void shouldPublishSnapshotOfFailedEventKeyedByTypeName() {
    OrderShippedEvent original = OrderShippedEvent.of("ord-77", "DHL");
    AttemptFailure failure =
        new AttemptFailure(3, FailureKind.ERROR, new IllegalStateException("carrier api down"));

    assertTrue(router.route(original, failure, 3));

    assertEquals(1, eventBus.deadLetters.size());
    DeadLetterEvent deadLetter = eventBus.deadLetters.get(0);
    assertEquals("OrderShippedEvent", eventBus.deadLetterRoutingKeys.get(0));
    assertEquals(OrderShippedEvent.class.getName(), deadLetter.originalEventType());
    assertEquals(original.id(), deadLetter.originalEventId());
    assertEquals(original, codec.decode(deadLetter.originalEventJson(), OrderShippedEvent.class));
    assertEquals("carrier api down", deadLetter.errorMessage());
    assertNotNull(deadLetter.stackTrace());
    assertTrue(deadLetter.stackTrace().contains("IllegalStateException"));
    assertEquals(FailureKind.ERROR, deadLetter.failureKind());
    assertEquals(3, deadLetter.attempts());
    assertEquals(NOW, deadLetter.failedAt());
    assertEquals(NOW, deadLetter.occurredOn());
  }

  @Test
  void shouldSwallowMissingDeadLetterConfiguration() {
    eventBus.deadLetterFailure =
        new PipelineException(PipelineErrorKind.CONFIGURATION, "No dead-letter exchange");

    boolean routed =
        router.route(
            OrderShippedEvent.of("ord-1", "UPS"),
            new AttemptFailure(1, FailureKind.ERROR, new RuntimeException("x")),
            1);

    assertFalse(routed);
  }

  @Test
  void shouldSwallowBrokerFailure() {
    CompletableFuture<Void> failed = new CompletableFuture<>();
    failed.completeExceptionally(
        new PipelineException(PipelineErrorKind.PUBLISH, "broker unavailable"));
    eventBus.deadLetterResult = failed;

    boolean routed =
        router.route(
            OrderShippedEvent.of("ord-1", "UPS"),
            new AttemptFailure(2, FailureKind.TIMEOUT_EXCEEDED, new TimeoutException("slow")),
            2);

    assertFalse(routed);
  }

  @Test
  void shouldGiveUpWhenPublishIsNotConfirmedInTime() {
    eventBus.deadLetterResult = new CompletableFuture<>();

    boolean routed =
        router.route(
            OrderShippedEvent.of("ord-1", "UPS"),
            new AttemptFailure(1, FailureKind.ERROR, new RuntimeException("x")),
            1);

    assertFalse(routed);
  }

  @Test
  void shouldUsePlaceholderWhenErrorHasNoMessage() {
    router.route(
        OrderShippedEvent.of("ord-2", "FedEx"),
        new AttemptFailure(1, FailureKind.ERROR, new NullPointerException()),
        1);

    assertEquals("NullPointerException", eventBus.deadLetters.get(0).errorMessage());
  }
}
