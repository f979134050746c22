package com.servicescaffold.core.jobs.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.servicescaffold.core.events.DeadLetterEvent;
import com.servicescaffold.core.jobs.InvoiceIssuedEvent;
import com.servicescaffold.core.jobs.OrderShippedEvent;
import com.servicescaffold.core.jobs.RecordingEventBus;
import com.servicescaffold.core.jobs.bootstrap.BackgroundJobProcessorLifecycle;
import com.servicescaffold.core.jobs.bootstrap.BackgroundJobSubscriber;
import com.servicescaffold.core.jobs.handler.BackgroundJobHandler;
import com.servicescaffold.core.jobs.handler.HandlerRegistry;
import com.servicescaffold.core.jobs.metrics.JobMetrics;
import com.servicescaffold.core.jobs.metrics.JobMetricsReporter;
import com.servicescaffold.core.jobs.metrics.MicrometerJobMetrics;
import com.servicescaffold.core.jobs.metrics.NoOpJobMetrics;
import com.servicescaffold.core.jobs.processor.BackgroundJobProcessor;
import com.servicescaffold.core.jobs.retry.ExponentialBackoffRetryPolicy;
import com.servicescaffold.core.jobs.retry.RetryPolicy;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.infra.eventbus.config.EventBusAutoConfiguration;
import com.servicescaffold.infra.eventbus.observability.EventBusTelemetry;
import com.servicescaffold.infra.eventbus.observability.MicrometerEventBusTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class BackgroundJobAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  EventBusAutoConfiguration.class, BackgroundJobAutoConfiguration.class))
          .withBean(ShipmentNotifier.class, ShipmentNotifier::new)
          .withPropertyValues(
              "infra.eventbus.initialize-on-startup=false",
              "core.jobs.auto-subscribe=false",
              "core.jobs.metrics-reporting-interval-ms=0");

  @Test
  void shouldWireProcessorAndDiscoverHandlerBeans() {
    contextRunner.run(
        context -> {
          assertEquals(1, context.getBeansOfType(BackgroundJobProcessor.class).size());
          HandlerRegistry registry = context.getBean(HandlerRegistry.class);
          assertEquals(1, registry.size());
          assertTrue(registry.find(OrderShippedEvent.class).isPresent());
          assertTrue(context.getBeansOfType(BackgroundJobSubscriber.class).isEmpty());
          assertTrue(context.getBeansOfType(JobMetricsReporter.class).isEmpty());
        });
  }

  @Test
  void shouldBuildRetryPolicyFromProperties() {
    contextRunner
        .withPropertyValues(
            "core.jobs.max-attempts=5",
            "core.jobs.base-delay-ms=100",
            "core.jobs.max-delay-ms=250")
        .run(
            context -> {
              RetryPolicy policy = context.getBean(RetryPolicy.class);
              assertEquals(ExponentialBackoffRetryPolicy.class, policy.getClass());
              assertEquals(5, policy.maxAttempts());
              assertEquals(Duration.ofMillis(100), policy.backoffForAttempt(1));
              assertEquals(Duration.ofMillis(250), policy.backoffForAttempt(4));
            });
  }

  @Test
  void shouldUseNoOpMetricsWhenMeterRegistryIsMissing() {
    contextRunner.run(
        context ->
            assertEquals(NoOpJobMetrics.class, context.getBean(JobMetrics.class).getClass()));
  }

  @Test
  void shouldUseMicrometerMetricsWhenMeterRegistryIsPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertEquals(
                    MicrometerJobMetrics.class, context.getBean(JobMetrics.class).getClass()));
  }

  @Test
  void shouldUseMicrometerMetricsWithActuatorMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(
            AutoConfigurations.of(
                EventBusAutoConfiguration.class,
                BackgroundJobAutoConfiguration.class,
                MetricsAutoConfiguration.class,
                CompositeMeterRegistryAutoConfiguration.class,
                SimpleMetricsExportAutoConfiguration.class))
        .withBean(ShipmentNotifier.class, ShipmentNotifier::new)
        .withPropertyValues(
            "infra.eventbus.initialize-on-startup=false",
            "core.jobs.auto-subscribe=false",
            "core.jobs.metrics-reporting-interval-ms=0")
        .run(
            context -> {
              assertEquals(
                  MicrometerJobMetrics.class, context.getBean(JobMetrics.class).getClass());
              assertEquals(
                  MicrometerEventBusTelemetry.class,
                  context.getBean(EventBusTelemetry.class).getClass());
            });
  }

  @Test
  void shouldRegisterMetricsReporterWhenIntervalIsPositive() {
    contextRunner
        .withPropertyValues("core.jobs.metrics-reporting-interval-ms=60000")
        .run(context -> assertEquals(1, context.getBeansOfType(JobMetricsReporter.class).size()));
  }

  @Test
  void shouldSubscribeHandlersOnStartupWhenAutoSubscribeIsEnabled() {
    RecordingEventBus eventBus = new RecordingEventBus();
    contextRunner
        .withBean(IntegrationEventBus.class, () -> eventBus)
        .withPropertyValues("core.jobs.auto-subscribe=true")
        .run(
            context -> {
              BackgroundJobSubscriber subscriber = context.getBean(BackgroundJobSubscriber.class);
              assertTrue(subscriber.isRunning());
              assertEquals(1, eventBus.initializeCalls());
              assertEquals(1, eventBus.subscriptions.size());
              assertEquals(
                  "OrderShippedEvent", eventBus.subscriptions.get(0).eventType());
            });
  }

  @Test
  void shouldDrainJobsAndDeadLetterBeforeEventBusClosesOnShutdown() {
    ShutdownOrderEventBus eventBus = new ShutdownOrderEventBus();
    SlowFailingInvoiceHandler handler = new SlowFailingInvoiceHandler();
    contextRunner
        .withBean(IntegrationEventBus.class, () -> eventBus)
        .withBean(SlowFailingInvoiceHandler.class, () -> handler)
        .withPropertyValues(
            "infra.eventbus.initialize-on-startup=true",
            "core.jobs.max-attempts=1",
            "core.jobs.shutdown-grace-period-ms=5000")
        .run(
            context -> {
              assertEquals(1, context.getBeansOfType(BackgroundJobProcessorLifecycle.class).size());
              context
                  .getBean(BackgroundJobProcessor.class)
                  .process(InvoiceIssuedEvent.of("inv-77", new BigDecimal("12.00")));
              assertTrue(handler.started.await(5, TimeUnit.SECONDS));

              context.close();

              assertEquals("dead-lettered", eventBus.steps.get(0));
              assertTrue(eventBus.steps.contains("bus-closed"));
              assertFalse(eventBus.steps.contains("dead-letter-after-close"));
              assertEquals(1, eventBus.deadLetters.size());
            });
  }

  static class ShutdownOrderEventBus extends RecordingEventBus {
    final List<String> steps = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> publishDeadLetter(DeadLetterEvent event, String routingKey) {
      steps.add(isInitialized() ? "dead-lettered" : "dead-letter-after-close");
      return super.publishDeadLetter(event, routingKey);
    }

    @Override
    public void close() {
      steps.add("bus-closed");
      super.close();
    }
  }

  static class SlowFailingInvoiceHandler implements BackgroundJobHandler<InvoiceIssuedEvent> {
    final CountDownLatch started = new CountDownLatch(1);

    @Override
    public void handle(InvoiceIssuedEvent event) throws InterruptedException {
      started.countDown();
      Thread.sleep(300L);
      throw new IllegalStateException("ledger offline");
    }
  }

  static class ShipmentNotifier implements BackgroundJobHandler<OrderShippedEvent> {
    @Override
    public void handle(OrderShippedEvent event) {}
  }
}
