package com.servicescaffold.product.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.core.jobs.config.BackgroundJobAutoConfiguration;
import com.servicescaffold.core.jobs.handler.HandlerRegistry;
import com.servicescaffold.core.jobs.processor.BackgroundJobProcessor;
import com.servicescaffold.core.jobs.processor.JobResult;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.infra.eventbus.config.EventBusAutoConfiguration;
import com.servicescaffold.product.email.EmailService;
import com.servicescaffold.product.email.LoggingEmailService;
import com.servicescaffold.product.email.SmtpEmailService;
import com.servicescaffold.product.events.ProductCreatedEvent;
import com.servicescaffold.product.events.SendEmailEvent;
import com.servicescaffold.product.jobs.ProductCreatedJobHandler;
import com.servicescaffold.product.jobs.SendEmailJobHandler;
import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class ProductWorkerWiringTest {
  private final IntegrationEventBus eventBus = mock(IntegrationEventBus.class);

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  EventBusAutoConfiguration.class,
                  BackgroundJobAutoConfiguration.class,
                  MailSenderAutoConfiguration.class))
          .withBean(IntegrationEventBus.class, () -> eventBus)
          .withUserConfiguration(ProductWorkerTestConfiguration.class)
          .withPropertyValues(
              "infra.eventbus.initialize-on-startup=false",
              "core.jobs.auto-subscribe=false",
              "core.jobs.metrics-reporting-interval-ms=0",
              "core.jobs.handler-packages=com.servicescaffold.product",
              "product.notifications.recipient=catalog@example.com");

  @Test
  void shouldRegisterProductJobHandlers() {
    contextRunner.run(
        context -> {
          HandlerRegistry registry = context.getBean(HandlerRegistry.class);
          assertEquals(2, registry.size());
          assertTrue(registry.find(ProductCreatedEvent.class).isPresent());
          assertTrue(registry.find(SendEmailEvent.class).isPresent());
          assertEquals(LoggingEmailService.class, context.getBean(EmailService.class).getClass());
        });
  }

  @Test
  void shouldSendEmailOverSmtpWhenMailHostIsConfigured() {
    contextRunner
        .withPropertyValues("spring.mail.host=smtp.example.com", "spring.mail.port=2525")
        .run(
            context ->
                assertEquals(
                    SmtpEmailService.class, context.getBean(EmailService.class).getClass()));
  }

  @Test
  void shouldRunProductCreatedJobThroughProcessor() {
    when(eventBus.publish(any())).thenReturn(CompletableFuture.completedFuture(null));
    contextRunner.run(
        context -> {
          BackgroundJobProcessor processor = context.getBean(BackgroundJobProcessor.class);
          ProductCreatedEvent event = ProductCreatedEvent.of("Desk Lamp", new BigDecimal("39.50"));

          JobResult result = processor.execute(event);

          assertEquals(1, result.attempts());
          assertEquals("ProductCreatedEvent", result.eventType());
          ArgumentCaptor<IntegrationEvent> captor = ArgumentCaptor.forClass(IntegrationEvent.class);
          verify(eventBus).publish(captor.capture());
          assertEquals("catalog@example.com", ((SendEmailEvent) captor.getValue()).to());
        });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ProductNotificationProperties.class)
  @Import({ProductWorkerConfiguration.class, SendEmailJobHandler.class, ProductCreatedJobHandler.class})
  static class ProductWorkerTestConfiguration {}
}
