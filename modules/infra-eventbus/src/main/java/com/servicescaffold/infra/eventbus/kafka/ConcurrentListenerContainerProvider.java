package com.servicescaffold.infra.eventbus.kafka;

import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListenerContainer;

public class ConcurrentListenerContainerProvider implements ListenerContainerProvider {
  private final ConsumerFactory<String, String> consumerFactory;
  private final int concurrency;

  public ConcurrentListenerContainerProvider(
      ConsumerFactory<String, String> consumerFactory, int concurrency) {
    this.consumerFactory =
        Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    this.concurrency = Math.max(1, concurrency);
  }

  @Override
  public MessageListenerContainer create(
      String exchange, String groupId, AcknowledgingMessageListener<String, String> listener) {
    ContainerProperties containerProperties = new ContainerProperties(exchange);
    containerProperties.setGroupId(groupId);
    containerProperties.setMessageListener(listener);
    // Jobs finish out of order on worker threads; the container commits acks on its own thread.
    containerProperties.setAckMode(ContainerProperties.AckMode.MANUAL);
    containerProperties.setAsyncAcks(true);

    // A fresh group sees only what is published after it binds.
    Properties consumerOverrides = new Properties();
    consumerOverrides.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    consumerOverrides.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    containerProperties.setKafkaConsumerProperties(consumerOverrides);

    ConcurrentMessageListenerContainer<String, String> container =
        new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
    container.setConcurrency(concurrency);
    container.setBeanName(groupId);
    return container;
  }
}
