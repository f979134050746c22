package com.servicescaffold.infra.eventbus.topics;

import java.util.regex.Pattern;

public final class ExchangeNameValidator {
    private static final Pattern EXCHANGE_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,249}$");

    private ExchangeNameValidator() {
    }

    public static void assertValid(String exchangeName) {
        if (!isValid(exchangeName)) {
            throw new IllegalArgumentException("Invalid exchange name: " + exchangeName);
        }
    }

    public static boolean isValid(String exchangeName) {
        return exchangeName != null
                && EXCHANGE_PATTERN.matcher(exchangeName).matches()
                && !".".equals(exchangeName)
                && !"..".equals(exchangeName);
    }
}
