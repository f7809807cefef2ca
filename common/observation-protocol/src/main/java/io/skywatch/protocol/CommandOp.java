package io.skywatch.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations the executor understands. The wire carries the lower-case name.
 */
public enum CommandOp {
    SWITCH,
    VNA,
    SENSOR,
    CORRELATOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandOp> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CommandOp op : values()) {
            if (op.wireName().equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
