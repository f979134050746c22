package com.servicescaffold.infra.eventbus.topics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ExchangeNameValidatorTest {
    @Test
    void shouldAcceptDefaultExchangeNames() {
        assertTrue(ExchangeNameValidator.isValid("integration_events"));
        assertTrue(ExchangeNameValidator.isValid("my-service.dlx"));
        assertDoesNotThrow(() -> ExchangeNameValidator.assertValid("orders.v1"));
    }

    @Test
    void shouldRejectNamesTheBrokerCannotHold() {
        assertFalse(ExchangeNameValidator.isValid(null));
        assertFalse(ExchangeNameValidator.isValid(""));
        assertFalse(ExchangeNameValidator.isValid("."));
        assertFalse(ExchangeNameValidator.isValid(".."));
        assertFalse(ExchangeNameValidator.isValid("integration events"));
        assertFalse(ExchangeNameValidator.isValid("a".repeat(250)));
        assertThrows(IllegalArgumentException.class, () -> ExchangeNameValidator.assertValid("bad/name"));
    }
}
