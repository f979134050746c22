package com.servicescaffold.infra.eventbus.kafka;

import com.servicescaffold.core.events.DeadLetterEvent;
import com.servicescaffold.core.events.EventTypeNames;
import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.events.errors.PipelineErrorKind;
import com.servicescaffold.core.events.errors.PipelineException;
import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.infra.eventbus.EventSubscription;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.infra.eventbus.IntegrationEventCallback;
import com.servicescaffold.infra.eventbus.config.EventBusProperties;
import com.servicescaffold.infra.eventbus.contract.EventHeaders;
import com.servicescaffold.infra.eventbus.observability.EventBusTelemetry;
import com.servicescaffold.infra.eventbus.topics.ExchangeNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.SendResult;

public class KafkaIntegrationEventBus implements IntegrationEventBus {
  private static final Logger log = LoggerFactory.getLogger(KafkaIntegrationEventBus.class);

  private enum State {
    NEW,
    INITIALIZED,
    CLOSED
  }

  private final KafkaAdmin kafkaAdmin;
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ListenerContainerProvider containerProvider;
  private final IntegrationEventJsonCodec codec;
  private final EventBusTelemetry telemetry;
  private final String exchange;
  private final String deadLetterExchange;
  private final int partitions;
  private final short replicationFactor;
  private final String groupPrefix;
  private final Duration sendTimeout;

  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final List<KafkaEventSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private volatile State state = State.NEW;

  public KafkaIntegrationEventBus(
      KafkaAdmin kafkaAdmin,
      KafkaTemplate<String, String> kafkaTemplate,
      ListenerContainerProvider containerProvider,
      IntegrationEventJsonCodec codec,
      EventBusTelemetry telemetry,
      EventBusProperties properties) {
    this.kafkaAdmin = Objects.requireNonNull(kafkaAdmin, "kafkaAdmin must not be null");
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.containerProvider =
        Objects.requireNonNull(containerProvider, "containerProvider must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    Objects.requireNonNull(properties, "properties must not be null");

    ExchangeNameValidator.assertValid(properties.getExchange());
    this.exchange = properties.getExchange();
    if (properties.isDeadLetterEnabled()) {
      ExchangeNameValidator.assertValid(properties.getDeadLetterExchange());
      this.deadLetterExchange = properties.getDeadLetterExchange();
    } else {
      this.deadLetterExchange = null;
    }
    this.partitions = Math.max(1, properties.getPartitions());
    this.replicationFactor = (short) Math.max(1, properties.getReplicationFactor());
    this.groupPrefix = properties.getSubscriptionGroupPrefix();
    this.sendTimeout = Duration.ofMillis(Math.max(0L, properties.getProducer().getSendTimeoutMs()));
  }

  @Override
  public void initialize() {
    lifecycleLock.lock();
    try {
      if (state == State.INITIALIZED) {
        return;
      }
      if (state == State.CLOSED) {
        throw new PipelineException(
            PipelineErrorKind.NOT_INITIALIZED, "Event bus has been closed");
      }

      List<NewTopic> topics = new ArrayList<>();
      topics.add(durableTopic(exchange));
      if (deadLetterExchange != null) {
        topics.add(durableTopic(deadLetterExchange));
      }
      try {
        kafkaAdmin.createOrModifyTopics(topics.toArray(new NewTopic[0]));
      } catch (RuntimeException ex) {
        throw new PipelineException(
            PipelineErrorKind.CONNECTION,
            "Failed to declare exchanges exchange=" + exchange + " dlx=" + deadLetterExchange,
            ex);
      }

      state = State.INITIALIZED;
      log.info(
          "Event bus initialized exchange={} dlx={} partitions={}",
          exchange,
          deadLetterExchange,
          partitions);
    } finally {
      lifecycleLock.unlock();
    }
  }

  @Override
  public boolean isInitialized() {
    return state == State.INITIALIZED;
  }

  @Override
  public CompletableFuture<Void> publish(IntegrationEvent event) {
    requireInitialized();
    Objects.requireNonNull(event, "event must not be null");
    String eventType = EventTypeNames.of(event);

    ProducerRecord<String, String> record =
        new ProducerRecord<>(exchange, null, codec.encode(event));
    addHeaders(record, EventTypeNames.qualified(event));

    return send(record, exchange, eventType)
        .thenRun(
            () ->
                log.info(
                    "Published event event_type={} event_id={} exchange={}",
                    eventType,
                    event.id(),
                    exchange));
  }

  @Override
  public CompletableFuture<Void> publishDeadLetter(DeadLetterEvent event, String routingKey) {
    requireInitialized();
    Objects.requireNonNull(event, "event must not be null");
    if (deadLetterExchange == null) {
      throw new PipelineException(
          PipelineErrorKind.CONFIGURATION, "No dead-letter exchange is configured");
    }
    if (routingKey == null || routingKey.isBlank()) {
      throw new IllegalArgumentException("routingKey must not be blank");
    }
    String eventType = EventTypeNames.of(event);

    ProducerRecord<String, String> record =
        new ProducerRecord<>(deadLetterExchange, routingKey, codec.encode(event));
    addHeaders(record, EventTypeNames.qualified(event));
    return send(record, deadLetterExchange, eventType);
  }

  @Override
  public <T extends IntegrationEvent> EventSubscription subscribe(
      Class<T> eventType, IntegrationEventCallback<T> callback) {
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(callback, "callback must not be null");
    String eventTypeName = EventTypeNames.of(eventType);
    String groupId = groupPrefix + "." + eventTypeName + "." + UUID.randomUUID();

    lifecycleLock.lock();
    try {
      requireInitialized();
      SubscriptionMessageListener<T> listener =
          new SubscriptionMessageListener<>(exchange, eventType, codec, callback, telemetry);
      MessageListenerContainer container = containerProvider.create(exchange, groupId, listener);
      KafkaEventSubscription subscription =
          new KafkaEventSubscription(eventTypeName, groupId, container, subscriptions::remove);
      container.start();
      subscriptions.add(subscription);
      log.info("Subscribed event_type={} queue={}", eventTypeName, groupId);
      return subscription;
    } finally {
      lifecycleLock.unlock();
    }
  }

  @Override
  public void close() {
    lifecycleLock.lock();
    try {
      if (state == State.CLOSED) {
        return;
      }
      state = State.CLOSED;
    } finally {
      lifecycleLock.unlock();
    }

    for (KafkaEventSubscription subscription : List.copyOf(subscriptions)) {
      try {
        subscription.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to stop subscription queue={}", subscription.queueName(), ex);
      }
    }
    subscriptions.clear();
    log.info("Event bus closed exchange={}", exchange);
  }

  List<EventSubscription> activeSubscriptions() {
    return List.copyOf(subscriptions);
  }

  private CompletableFuture<Void> send(
      ProducerRecord<String, String> record, String target, String eventType) {
    long started = System.nanoTime();
    CompletableFuture<SendResult<String, String>> sendFuture =
        applyTimeout(kafkaTemplate.send(record));

    CompletableFuture<Void> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(target, eventType, System.nanoTime() - started);
            result.complete(null);
            return;
          }
          PipelineException publishException = wrapPublishException(target, eventType, throwable);
          telemetry.onPublishFailure(target, eventType, publishException);
          log.warn(
              "Failed to publish event_type={} exchange={} reason={}",
              eventType,
              target,
              publishException.getMessage());
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private CompletableFuture<SendResult<String, String>> applyTimeout(
      CompletableFuture<SendResult<String, String>> sendFuture) {
    if (sendTimeout.isZero()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void requireInitialized() {
    State current = state;
    if (current == State.NEW) {
      throw new PipelineException(
          PipelineErrorKind.NOT_INITIALIZED, "Event bus is not initialized");
    }
    if (current == State.CLOSED) {
      throw new PipelineException(PipelineErrorKind.NOT_INITIALIZED, "Event bus has been closed");
    }
  }

  private NewTopic durableTopic(String name) {
    return TopicBuilder.name(name).partitions(partitions).replicas(replicationFactor).build();
  }

  private static PipelineException wrapPublishException(
      String target, String eventType, Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof PipelineException existing) {
      return existing;
    }
    String message =
        cause instanceof TimeoutException
            ? "Timed out publishing event to exchange=" + target + " eventType=" + eventType
            : "Failed to publish event to exchange=" + target + " eventType=" + eventType;
    return new PipelineException(PipelineErrorKind.PUBLISH, eventType, null, message, cause);
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  private static void addHeaders(ProducerRecord<String, String> record, String qualifiedType) {
    record
        .headers()
        .add(EventHeaders.X_EVENT_TYPE, qualifiedType.getBytes(StandardCharsets.UTF_8));
    record
        .headers()
        .add(
            EventHeaders.CONTENT_TYPE,
            EventHeaders.APPLICATION_JSON.getBytes(StandardCharsets.UTF_8));
  }
}
