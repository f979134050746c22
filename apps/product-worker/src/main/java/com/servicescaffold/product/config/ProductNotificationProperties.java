package com.servicescaffold.product.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "product.notifications")
public class ProductNotificationProperties {
  private String sender = "no-reply@service-scaffold.local";
  private String recipient = "catalog-team@service-scaffold.local";
  private long publishTimeoutMs = 5000;

  public String getSender() {
    return sender;
  }

  public void setSender(String sender) {
    this.sender = sender;
  }

  public String getRecipient() {
    return recipient;
  }

  public void setRecipient(String recipient) {
    this.recipient = recipient;
  }

  public long getPublishTimeoutMs() {
    return publishTimeoutMs;
  }

  public void setPublishTimeoutMs(long publishTimeoutMs) {
    this.publishTimeoutMs = publishTimeoutMs;
  }
}
