package com.servicescaffold.product.jobs;

import com.servicescaffold.core.jobs.handler.BackgroundJobHandler;
import com.servicescaffold.infra.eventbus.IntegrationEventBus;
import com.servicescaffold.product.config.ProductNotificationProperties;
import com.servicescaffold.product.events.ProductCreatedEvent;
import com.servicescaffold.product.events.SendEmailEvent;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Schedules the catalog notification for a new product. The email goes out as its own job so
 * that a failing mail transport is retried without re-running this handler.
 */
@Component
public class ProductCreatedJobHandler implements BackgroundJobHandler<ProductCreatedEvent> {
  private static final Logger log = LoggerFactory.getLogger(ProductCreatedJobHandler.class);

  private final IntegrationEventBus eventBus;
  private final ProductNotificationProperties properties;

  public ProductCreatedJobHandler(
      IntegrationEventBus eventBus, ProductNotificationProperties properties) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  @Override
  public void handle(ProductCreatedEvent event)
      throws InterruptedException, ExecutionException, TimeoutException {
    SendEmailEvent email =
        SendEmailEvent.of(
            properties.getRecipient(),
            "New product: " + event.name(),
            "<p>Product <b>"
                + event.name()
                + "</b> was created with price "
                + event.price().setScale(2, RoundingMode.HALF_UP).toPlainString()
                + ".</p>");
    eventBus.publish(email).get(properties.getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
    log.info(
        "Scheduled product notification product_event_id={} email_event_id={} to={}",
        event.id(),
        email.id(),
        email.to());
  }
}
