package com.servicescaffold.product.jobs;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.servicescaffold.product.email.EmailService;
import com.servicescaffold.product.events.SendEmailEvent;
import org.junit.jupiter.api.Test;

class SendEmailJobHandlerTest {
  @Test
  void shouldDeliverEmailThroughService() {
    EmailService emailService = mock(EmailService.class);
    SendEmailJobHandler handler = new SendEmailJobHandler(emailService);

    handler.handle(SendEmailEvent.of("ops@example.com", "Weekly report", "<p>ok</p>"));

    verify(emailService).sendEmail("ops@example.com", "Weekly report", "<p>ok</p>", true);
  }

  @Test
  void shouldRethrowDeliveryFailureSoTheJobIsRetried() {
    EmailService emailService = mock(EmailService.class);
    IllegalStateException failure = new IllegalStateException("smtp unavailable");
    doThrow(failure).when(emailService).sendEmail(anyString(), anyString(), anyString(), anyBoolean());
    SendEmailJobHandler handler = new SendEmailJobHandler(emailService);

    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () -> handler.handle(SendEmailEvent.of("ops@example.com", "Report", "body")));

    assertSame(failure, thrown);
  }
}
