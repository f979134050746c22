package com.servicescaffold.product.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.servicescaffold.core.events.IntegrationEvent;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.product.config.ProductNotificationProperties;
import com.servicescaffold.product.events.ProductCreatedEvent;
import com.servicescaffold.product.events.SendEmailEvent;
import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ProductCreatedJobHandlerTest {
  private final IntegrationEventBus eventBus = mock(IntegrationEventBus.class);
  private final ProductNotificationProperties properties = new ProductNotificationProperties();

  @Test
  void shouldPublishNotificationEmailForNewProduct() throws Exception {
    properties.setRecipient("catalog@example.com");
    when(eventBus.publish(any())).thenReturn(CompletableFuture.completedFuture(null));
    ProductCreatedJobHandler handler = new ProductCreatedJobHandler(eventBus, properties);

    handler.handle(ProductCreatedEvent.of("Desk Lamp", new BigDecimal("39.5")));

    ArgumentCaptor<IntegrationEvent> captor = ArgumentCaptor.forClass(IntegrationEvent.class);
    verify(eventBus).publish(captor.capture());
    SendEmailEvent email = (SendEmailEvent) captor.getValue();
    assertEquals("catalog@example.com", email.to());
    assertEquals("New product: Desk Lamp", email.subject());
    assertTrue(email.body().contains("39.50"));
    assertTrue(email.html());
  }

  @Test
  void shouldFailWhenPublishFails() {
    RuntimeException brokerDown = new RuntimeException("broker down");
    when(eventBus.publish(any())).thenReturn(CompletableFuture.failedFuture(brokerDown));
    ProductCreatedJobHandler handler = new ProductCreatedJobHandler(eventBus, properties);

    ExecutionException thrown =
        assertThrows(
            ExecutionException.class,
            () -> handler.handle(ProductCreatedEvent.of("Chair", BigDecimal.TEN)));

    assertSame(brokerDown, thrown.getCause());
  }

  @Test
  void shouldTimeOutWhenPublishIsNotConfirmed() {
    properties.setPublishTimeoutMs(50);
    when(eventBus.publish(any())).thenReturn(new CompletableFuture<>());
    ProductCreatedJobHandler handler = new ProductCreatedJobHandler(eventBus, properties);

    assertThrows(
        TimeoutException.class,
        () -> handler.handle(ProductCreatedEvent.of("Sofa", BigDecimal.ONE)));
  }
}
