package io.skywatch.protocol;

import java.util.Locale;

public enum CommandResult {
    OK,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CommandResult fromWire(String value) {
        if (value != null) {
            for (CommandResult result : values()) {
                if (result.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return result;
                }
            }
        }
        throw new IllegalArgumentException("Unknown command result '" + value + "'");
    }
}
