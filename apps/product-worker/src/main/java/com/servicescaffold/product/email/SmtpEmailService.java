package com.servicescaffold.product.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

/** Sends mail through the SMTP server configured under {@code spring.mail.*}. */
public class SmtpEmailService implements EmailService {
  private static final Logger log = LoggerFactory.getLogger(SmtpEmailService.class);

  private final JavaMailSender mailSender;
  private final String sender;

  public SmtpEmailService(JavaMailSender mailSender, String sender) {
    this.mailSender = Objects.requireNonNull(mailSender, "mailSender must not be null");
    if (sender == null || sender.isBlank()) {
      throw new IllegalArgumentException("sender must not be blank");
    }
    this.sender = sender;
  }

  @Override
  public void sendEmail(String to, String subject, String body, boolean html) {
    try {
      MimeMessage message = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
      helper.setFrom(sender);
      helper.setTo(to);
      helper.setSubject(subject == null ? "" : subject);
      helper.setText(body == null ? "" : body, html);
      mailSender.send(message);
      log.info("Email handed to SMTP server to={} subject={}", to, subject);
    } catch (MessagingException | MailException ex) {
      throw new EmailDeliveryException(to, "Failed to send email to " + to, ex);
    }
  }
}
