package com.servicescaffold.infra.eventbus.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.eventbus")
public class EventBusProperties {
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private String exchange = "integration_events";
  private String deadLetterExchange = "my-service.dlx";
  private int partitions = 1;
  private int replicationFactor = 1;
  private String subscriptionGroupPrefix = "service-scaffold";
  private boolean telemetryEnabled = true;
  private boolean initializeOnStartup = true;
  private int adminOperationTimeoutSeconds = 30;
  private Producer producer = new Producer();
  private Consumer consumer = new Consumer();

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getExchange() {
    return exchange;
  }

  public void setExchange(String exchange) {
    this.exchange = exchange;
  }

  public String getDeadLetterExchange() {
    return deadLetterExchange;
  }

  public void setDeadLetterExchange(String deadLetterExchange) {
    this.deadLetterExchange = deadLetterExchange;
  }

  public int getPartitions() {
    return partitions;
  }

  public void setPartitions(int partitions) {
    this.partitions = partitions;
  }

  public int getReplicationFactor() {
    return replicationFactor;
  }

  public void setReplicationFactor(int replicationFactor) {
    this.replicationFactor = replicationFactor;
  }

  public String getSubscriptionGroupPrefix() {
    return subscriptionGroupPrefix;
  }

  public void setSubscriptionGroupPrefix(String subscriptionGroupPrefix) {
    this.subscriptionGroupPrefix = subscriptionGroupPrefix;
  }

  public boolean isTelemetryEnabled() {
    return telemetryEnabled;
  }

  public void setTelemetryEnabled(boolean telemetryEnabled) {
    this.telemetryEnabled = telemetryEnabled;
  }

  public boolean isInitializeOnStartup() {
    return initializeOnStartup;
  }

  public void setInitializeOnStartup(boolean initializeOnStartup) {
    this.initializeOnStartup = initializeOnStartup;
  }

  public int getAdminOperationTimeoutSeconds() {
    return adminOperationTimeoutSeconds;
  }

  public void setAdminOperationTimeoutSeconds(int adminOperationTimeoutSeconds) {
    this.adminOperationTimeoutSeconds = adminOperationTimeoutSeconds;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  public boolean isDeadLetterEnabled() {
    return deadLetterExchange != null && !deadLetterExchange.isBlank();
  }

  public static class Producer {
    private String clientId = "service-scaffold-producer";
    private String acks = "all";
    private boolean idempotenceEnabled = true;
    private int lingerMs = 5;
    private int deliveryTimeoutMs = 120000;
    private int requestTimeoutMs = 30000;
    private long sendTimeoutMs = 0L;

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotenceEnabled() {
      return idempotenceEnabled;
    }

    public void setIdempotenceEnabled(boolean idempotenceEnabled) {
      this.idempotenceEnabled = idempotenceEnabled;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }
  }

  public static class Consumer {
    private int concurrency = 1;
    private int maxPollRecords = 500;
    private int maxPollIntervalMs = 300000;
    private int sessionTimeoutMs = 10000;
    private int heartbeatIntervalMs = 3000;

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(int concurrency) {
      this.concurrency = concurrency;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public int getMaxPollIntervalMs() {
      return maxPollIntervalMs;
    }

    public void setMaxPollIntervalMs(int maxPollIntervalMs) {
      this.maxPollIntervalMs = maxPollIntervalMs;
    }

    public int getSessionTimeoutMs() {
      return sessionTimeoutMs;
    }

    public void setSessionTimeoutMs(int sessionTimeoutMs) {
      this.sessionTimeoutMs = sessionTimeoutMs;
    }

    public int getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(int heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }
  }
}
