package com.servicescaffold.product.email;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

class SmtpEmailServiceTest {
  private final JavaMailSender mailSender = mock(JavaMailSender.class);

  @BeforeEach
  void setUp() {
    when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
  }

  @Test
  void shouldSendMimeMessageFromConfiguredSender() throws Exception {
    SmtpEmailService service = new SmtpEmailService(mailSender, "no-reply@example.com");

    service.sendEmail("ops@example.com", "New product: Desk Lamp", "<p>created</p>", true);

    ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
    verify(mailSender).send(captor.capture());
    MimeMessage message = captor.getValue();
    assertEquals("New product: Desk Lamp", message.getSubject());
    assertEquals("no-reply@example.com", message.getFrom()[0].toString());
    assertEquals("ops@example.com", message.getAllRecipients()[0].toString());
    assertEquals("<p>created</p>", message.getContent());
    assertTrue(message.getDataHandler().getContentType().startsWith("text/html"));
  }

  @Test
  void shouldWrapMailFailureSoTheJobIsRetried() {
    MailSendException refused = new MailSendException("connection refused");
    doThrow(refused).when(mailSender).send(any(MimeMessage.class));
    SmtpEmailService service = new SmtpEmailService(mailSender, "no-reply@example.com");

    EmailDeliveryException thrown =
        assertThrows(
            EmailDeliveryException.class,
            () -> service.sendEmail("ops@example.com", "Report", "body", false));

    assertEquals("ops@example.com", thrown.getRecipient());
    assertInstanceOf(MailSendException.class, thrown.getCause());
  }
}
