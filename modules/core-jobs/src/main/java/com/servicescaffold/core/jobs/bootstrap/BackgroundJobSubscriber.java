package com.servicescaffold.core.jobs.bootstrap;

import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.jobs.handler.HandlerRegistry;
import com.servicescaffold.core.jobs.processor.BackgroundJobProcessor;
import com.servicescaffold.infra.eventbus.EventSubscription;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Subscribes the job processor to every event type that has a registered handler once the
 * application starts, and unsubscribes on shutdown.
 */
public class BackgroundJobSubscriber implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(BackgroundJobSubscriber.class);

  private final IntegrationEventBus eventBus;
  private final BackgroundJobProcessor processor;
  private final HandlerRegistry registry;
  private final List<EventSubscription> subscriptions = new ArrayList<>();
  private volatile boolean running;

  public BackgroundJobSubscriber(
      IntegrationEventBus eventBus, BackgroundJobProcessor processor, HandlerRegistry registry) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    this.processor = Objects.requireNonNull(processor, "processor must not be null");
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    eventBus.initialize();
    for (Class<? extends IntegrationEvent> eventType : registry.eventTypes()) {
      subscriptions.add(subscribe(eventType));
    }
    running = true;
    log.info("Background job subscriptions started count={}", subscriptions.size());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    for (EventSubscription subscription : subscriptions) {
      try {
        subscription.close();
      } catch (RuntimeException ex) {
        log.warn(
            "Failed to close subscription event_type={} queue={}",
            subscription.eventType(),
            subscription.queueName(),
            ex);
      }
    }
    subscriptions.clear();
    log.info("Background job subscriptions stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public synchronized List<EventSubscription> subscriptions() {
    return List.copyOf(subscriptions);
  }

  private <T extends IntegrationEvent> EventSubscription subscribe(Class<T> eventType) {
    EventSubscription subscription = eventBus.subscribe(eventType, processor::process);
    log.info(
        "Subscribed background jobs event_type={} queue={}",
        subscription.eventType(),
        subscription.queueName());
    return subscription;
  }
}
