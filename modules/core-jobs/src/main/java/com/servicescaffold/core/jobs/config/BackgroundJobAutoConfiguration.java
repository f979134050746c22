package com.servicescaffold.core.jobs.config;

import com.servicescaffold.core.events.serde.IntegrationEventJsonCodec;
import com.servicescaffold.core.jobs.bootstrap.BackgroundJobProcessorLifecycle;
import com.servicescaffold.core.jobs.bootstrap.BackgroundJobSubscriber;
import com.servicescaffold.core.jobs.deadletter.DeadLetterRouter;
import com.servicescaffold.core.jobs.handler.HandlerRegistry;
import com.servicescaffold.core.jobs.handler.SpringHandlerRegistryFactory;
import com.servicescaffold.core.jobs.metrics.JobMetrics;
import com.servicescaffold.core.jobs.metrics.JobMetricsReporter;
import com.servicescaffold.core.jobs.metrics.MicrometerJobMetrics;
import com.servicescaffold.core.jobs.metrics.NoOpJobMetrics;
import com.servicescaffold.core.jobs.processor.BackgroundJobProcessor;
import com.servicescaffold.core.jobs.retry.ExponentialBackoffRetryPolicy;
import com.servicescaffold.core.jobs.retry.RetryExecutor;
import com.servicescaffold.core.jobs.retry.RetryPolicy;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.infra.eventbus.config.EventBusAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(
    after = EventBusAutoConfiguration.class,
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(BackgroundJobProperties.class)
public class BackgroundJobAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(JobMetrics.class)
  public JobMetrics micrometerJobMetrics(MeterRegistry meterRegistry) {
    return new MicrometerJobMetrics(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(JobMetrics.class)
  public JobMetrics noOpJobMetrics() {
    return new NoOpJobMetrics();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy backgroundJobRetryPolicy(BackgroundJobProperties properties) {
    return new ExponentialBackoffRetryPolicy(
        properties.getMaxAttempts(),
        Duration.ofMillis(Math.max(0L, properties.getBaseDelayMs())),
        Duration.ofMillis(Math.max(0L, properties.getMaxDelayMs())));
  }

  @Bean(name = "backgroundJobAttemptExecutor", destroyMethod = "shutdownNow")
  @ConditionalOnMissingBean(name = "backgroundJobAttemptExecutor")
  public ExecutorService backgroundJobAttemptExecutor() {
    // Unbounded: an attempt that ignores interruption after a timeout must not starve the next.
    return Executors.newCachedThreadPool(namedDaemonThreads("job-attempt-"));
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryExecutor backgroundJobRetryExecutor(
      @Qualifier("backgroundJobAttemptExecutor") ExecutorService backgroundJobAttemptExecutor) {
    return new RetryExecutor(backgroundJobAttemptExecutor);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterRouter deadLetterRouter(
      IntegrationEventBus integrationEventBus,
      IntegrationEventJsonCodec integrationEventJsonCodec,
      BackgroundJobProperties properties) {
    return new DeadLetterRouter(
        integrationEventBus,
        integrationEventJsonCodec,
        Clock.systemUTC(),
        Duration.ofMillis(Math.max(1L, properties.getDeadLetterPublishTimeoutMs())));
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry backgroundJobHandlerRegistry(
      ListableBeanFactory beanFactory, BackgroundJobProperties properties) {
    return new SpringHandlerRegistryFactory(beanFactory, properties.getHandlerPackages()).create();
  }

  @Bean
  @ConditionalOnMissingBean
  public BackgroundJobProcessor backgroundJobProcessor(
      HandlerRegistry handlerRegistry,
      RetryExecutor retryExecutor,
      RetryPolicy retryPolicy,
      DeadLetterRouter deadLetterRouter,
      JobMetrics jobMetrics,
      BackgroundJobProperties properties) {
    ExecutorService jobExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, properties.getWorkerThreads()), namedDaemonThreads("background-job-"));
    return new BackgroundJobProcessor(
        handlerRegistry,
        retryExecutor,
        retryPolicy,
        Duration.ofSeconds(Math.max(0, properties.getTimeoutSeconds())),
        deadLetterRouter,
        jobMetrics,
        jobExecutor,
        Duration.ofMillis(Math.max(0L, properties.getShutdownGracePeriodMs())));
  }

  @Bean
  @ConditionalOnMissingBean
  public BackgroundJobProcessorLifecycle backgroundJobProcessorLifecycle(
      BackgroundJobProcessor backgroundJobProcessor) {
    return new BackgroundJobProcessorLifecycle(backgroundJobProcessor);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "core.jobs",
      name = "auto-subscribe",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public BackgroundJobSubscriber backgroundJobSubscriber(
      IntegrationEventBus integrationEventBus,
      BackgroundJobProcessor backgroundJobProcessor,
      HandlerRegistry handlerRegistry) {
    return new BackgroundJobSubscriber(
        integrationEventBus, backgroundJobProcessor, handlerRegistry);
  }

  @Bean
  @ConditionalOnExpression("${core.jobs.metrics-reporting-interval-ms:30000} > 0")
  @ConditionalOnMissingBean
  public JobMetricsReporter jobMetricsReporter(
      JobMetrics jobMetrics, BackgroundJobProperties properties) {
    return new JobMetricsReporter(
        jobMetrics, Duration.ofMillis(properties.getMetricsReportingIntervalMs()));
  }

  private static ThreadFactory namedDaemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
