package com.servicescaffold.core.jobs.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "core.jobs")
public class BackgroundJobProperties {
  private int maxAttempts = 3;
  private long baseDelayMs = 2000L;
  private long maxDelayMs = 60000L;
  private int timeoutSeconds = 10;
  private long deadLetterPublishTimeoutMs = 5000L;
  private List<String> handlerPackages = new ArrayList<>();
  private boolean autoSubscribe = true;
  private int workerThreads = 16;
  private long shutdownGracePeriodMs = 10000L;
  private long metricsReportingIntervalMs = 30000L;

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public long getBaseDelayMs() {
    return baseDelayMs;
  }

  public void setBaseDelayMs(long baseDelayMs) {
    this.baseDelayMs = baseDelayMs;
  }

  public long getMaxDelayMs() {
    return maxDelayMs;
  }

  public void setMaxDelayMs(long maxDelayMs) {
    this.maxDelayMs = maxDelayMs;
  }

  public int getTimeoutSeconds() {
    return timeoutSeconds;
  }

  public void setTimeoutSeconds(int timeoutSeconds) {
    this.timeoutSeconds = timeoutSeconds;
  }

  public long getDeadLetterPublishTimeoutMs() {
    return deadLetterPublishTimeoutMs;
  }

  public void setDeadLetterPublishTimeoutMs(long deadLetterPublishTimeoutMs) {
    this.deadLetterPublishTimeoutMs = deadLetterPublishTimeoutMs;
  }

  public List<String> getHandlerPackages() {
    return handlerPackages;
  }

  public void setHandlerPackages(List<String> handlerPackages) {
    this.handlerPackages = handlerPackages;
  }

  public boolean isAutoSubscribe() {
    return autoSubscribe;
  }

  public void setAutoSubscribe(boolean autoSubscribe) {
    this.autoSubscribe = autoSubscribe;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public long getShutdownGracePeriodMs() {
    return shutdownGracePeriodMs;
  }

  public void setShutdownGracePeriodMs(long shutdownGracePeriodMs) {
    this.shutdownGracePeriodMs = shutdownGracePeriodMs;
  }

  public long getMetricsReportingIntervalMs() {
    return metricsReportingIntervalMs;
  }

  public void setMetricsReportingIntervalMs(long metricsReportingIntervalMs) {
    this.metricsReportingIntervalMs = metricsReportingIntervalMs;
  }
}
