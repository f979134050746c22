package com.servicescaffold.product.email;

public interface EmailService {
  /** Delivers one message. A thrown exception makes the calling job retry. */
  void sendEmail(String to, String subject, String body, boolean html);
}
