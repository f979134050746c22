package com.servicescaffold.infra.eventbus.kafka;

import com.servicescaffold.infra.eventbus.EventSubscription;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.springframework.kafka.listener.MessageListenerContainer;

class KafkaEventSubscription implements EventSubscription {
  private final String eventType;
  private final String queueName;
  private final MessageListenerContainer container;
  private final Consumer<KafkaEventSubscription> onClose;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  KafkaEventSubscription(
      String eventType,
      String queueName,
      MessageListenerContainer container,
      Consumer<KafkaEventSubscription> onClose) {
    this.eventType = eventType;
    this.queueName = queueName;
    this.container = Objects.requireNonNull(container, "container must not be null");
    this.onClose = onClose;
  }

  @Override
  public String eventType() {
    return eventType;
  }

  @Override
  public String queueName() {
    return queueName;
  }

  @Override
  public boolean isActive() {
    return !closed.get() && container.isRunning();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    container.stop();
    if (onClose != null) {
      onClose.accept(this);
    }
  }
}
