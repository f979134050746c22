package com.servicescaffold.infra.eventbus.kafka;

import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.listener.MessageListenerContainer;

/** Creates, but does not start, the container that backs one subscription. */
@FunctionalInterface
public interface ListenerContainerProvider {
  MessageListenerContainer create(
      String exchange, String groupId, AcknowledgingMessageListener<String, String> listener);
}
