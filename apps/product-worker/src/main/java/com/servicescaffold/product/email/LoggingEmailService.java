package com.servicescaffold.product.email;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in transport that only logs the message. */
public class LoggingEmailService implements EmailService {
  private static final Logger log = LoggerFactory.getLogger(LoggingEmailService.class);

  private final String sender;

  public LoggingEmailService(String sender) {
    if (sender == null || sender.isBlank()) {
      throw new IllegalArgumentException("sender must not be blank");
    }
    this.sender = sender;
  }

  @Override
  public void sendEmail(String to, String subject, String body, boolean html) {
    log.info(
        "Email stub accepted from={} to={} subject={} html={} body_length={}",
        sender,
        to,
        subject,
        html,
        body == null ? 0 : body.length());
  }
}
