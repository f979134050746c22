package com.servicescaffold.product.config;

import com.servicescaffold.product.email.EmailService;
import com.servicescaffold.product.email.LoggingEmailService;
import com.servicescaffold.product.email.SmtpEmailService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class ProductWorkerConfiguration {
  @Bean
  @ConditionalOnProperty(prefix = "spring.mail", name = "host")
  @ConditionalOnMissingBean(EmailService.class)
  public EmailService smtpEmailService(
      ObjectProvider<JavaMailSender> mailSender, ProductNotificationProperties properties) {
    return new SmtpEmailService(mailSender.getObject(), properties.getSender());
  }

  @Bean
  @ConditionalOnMissingBean(EmailService.class)
  public EmailService loggingEmailService(ProductNotificationProperties properties) {
    return new LoggingEmailService(properties.getSender());
  }
}
