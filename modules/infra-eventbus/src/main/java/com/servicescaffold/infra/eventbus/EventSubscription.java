package com.servicescaffold.infra.eventbus;

public interface EventSubscription extends AutoCloseable {
  String eventType();

  /** Broker-side name of the exclusive queue backing this subscription. */
  String queueName();

  boolean isActive();

  @Override
  void close();
}
