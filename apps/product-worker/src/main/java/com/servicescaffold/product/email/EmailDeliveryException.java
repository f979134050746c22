package com.servicescaffold.product.email;

/** Raised when a message could not be handed to the mail server; the calling job retries. */
public class EmailDeliveryException extends RuntimeException {
  private final String recipient;

  public EmailDeliveryException(String recipient, String message, Throwable cause) {
    super(message, cause);
    this.recipient = recipient;
  }

  public String getRecipient() {
    return recipient;
  }
}
