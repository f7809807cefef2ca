package io.skywatch.executor.hardware;

import java.util.Locale;

/**
 * RF paths of the switch network: antenna (sky), matched load, noise source.
 */
public enum SwitchPath {
    RFANT,
    RFLOAD,
    RFNON;

    public static SwitchPath parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("switch path must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown switch path '" + value + "'", ex);
        }
    }
}
