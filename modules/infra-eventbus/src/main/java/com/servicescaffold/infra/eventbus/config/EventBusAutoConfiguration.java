package com.servicescaffold.infra.eventbus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicescaffold.core.events.serde.EventObjectMapperFactory;
import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.infra.eventbus.kafka.ConcurrentListenerContainerProvider;
import com.servicescaffold.infra.eventbus.kafka.KafkaIntegrationEventBus;
import com.servicescaffold.infra.eventbus.kafka.ListenerContainerProvider;
import com.servicescaffold.infra.eventbus.observability.EventBusTelemetry;
import com.servicescaffold.infra.eventbus.observability.MicrometerEventBusTelemetry;
import com.servicescaffold.infra.eventbus.observability.NoOpEventBusTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

// Ordered after the actuator meter registry so the Micrometer telemetry condition can see it.
@AutoConfiguration(
    before = KafkaAutoConfiguration.class,
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "eventBusObjectMapper")
  public ObjectMapper eventBusObjectMapper() {
    return EventObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public IntegrationEventJsonCodec integrationEventJsonCodec(
      @Qualifier("eventBusObjectMapper") ObjectMapper eventBusObjectMapper) {
    return new IntegrationEventJsonCodec(eventBusObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "infra.eventbus",
      name = "telemetry-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(EventBusTelemetry.class)
  public EventBusTelemetry micrometerEventBusTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerEventBusTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(EventBusTelemetry.class)
  public EventBusTelemetry noOpEventBusTelemetry() {
    return new NoOpEventBusTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean(name = "eventBusKafkaAdmin")
  public KafkaAdmin eventBusKafkaAdmin(EventBusProperties properties) {
    Map<String, Object> config = new HashMap<>();
    config.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    KafkaAdmin kafkaAdmin = new KafkaAdmin(config);
    kafkaAdmin.setOperationTimeout(Math.max(1, properties.getAdminOperationTimeoutSeconds()));
    kafkaAdmin.setAutoCreate(false);
    return kafkaAdmin;
  }

  @Bean
  @ConditionalOnMissingBean(name = "eventBusProducerFactory")
  public ProducerFactory<String, String> eventBusProducerFactory(EventBusProperties properties) {
    EventBusProperties.Producer producer = properties.getProducer();

    Map<String, Object> config = new HashMap<>();
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, producer.getClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotenceEnabled());
    config.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getDeliveryTimeoutMs());
    config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getRequestTimeoutMs());
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "eventBusKafkaTemplate")
  public KafkaTemplate<String, String> eventBusKafkaTemplate(
      @Qualifier("eventBusProducerFactory") ProducerFactory<String, String> eventBusProducerFactory) {
    return new KafkaTemplate<>(eventBusProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean(name = "eventBusConsumerFactory")
  public ConsumerFactory<String, String> eventBusConsumerFactory(EventBusProperties properties) {
    EventBusProperties.Consumer consumer = properties.getConsumer();

    Map<String, Object> config = new HashMap<>();
    config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxPollRecords());
    config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.getMaxPollIntervalMs());
    config.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, consumer.getSessionTimeoutMs());
    config.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, consumer.getHeartbeatIntervalMs());
    config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    return new DefaultKafkaConsumerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean
  public ListenerContainerProvider listenerContainerProvider(
      @Qualifier("eventBusConsumerFactory") ConsumerFactory<String, String> eventBusConsumerFactory,
      EventBusProperties properties) {
    return new ConcurrentListenerContainerProvider(
        eventBusConsumerFactory, properties.getConsumer().getConcurrency());
  }

  @Bean
  @ConditionalOnMissingBean
  public IntegrationEventBus integrationEventBus(
      @Qualifier("eventBusKafkaAdmin") KafkaAdmin eventBusKafkaAdmin,
      @Qualifier("eventBusKafkaTemplate") KafkaTemplate<String, String> eventBusKafkaTemplate,
      ListenerContainerProvider listenerContainerProvider,
      IntegrationEventJsonCodec integrationEventJsonCodec,
      EventBusTelemetry eventBusTelemetry,
      EventBusProperties properties) {
    return new KafkaIntegrationEventBus(
        eventBusKafkaAdmin,
        eventBusKafkaTemplate,
        listenerContainerProvider,
        integrationEventJsonCodec,
        eventBusTelemetry,
        properties);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.eventbus",
      name = "initialize-on-startup",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public EventBusLifecycle eventBusLifecycle(IntegrationEventBus integrationEventBus) {
    return new EventBusLifecycle(integrationEventBus);
  }
}
