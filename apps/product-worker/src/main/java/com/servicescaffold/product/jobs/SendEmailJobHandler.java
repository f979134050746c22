package com.servicescaffold.product.jobs;

import com.servicescaffold.core.jobs.handler.BackgroundJobHandler;
import com.servicescaffold.product.email.EmailService;
import com.servicescaffold.product.events.SendEmailEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SendEmailJobHandler implements BackgroundJobHandler<SendEmailEvent> {
  private static final Logger log = LoggerFactory.getLogger(SendEmailJobHandler.class);

  private final EmailService emailService;

  public SendEmailJobHandler(EmailService emailService) {
    this.emailService = Objects.requireNonNull(emailService, "emailService must not be null");
  }

  @Override
  public void handle(SendEmailEvent event) {
    log.info("Sending email event_id={} to={}", event.id(), event.to());
    try {
      emailService.sendEmail(event.to(), event.subject(), event.body(), event.html());
    } catch (RuntimeException ex) {
      log.warn("Failed to send email event_id={} to={}", event.id(), event.to(), ex);
      throw ex;
    }
    log.info("Email sent event_id={} to={}", event.id(), event.to());
  }
}
