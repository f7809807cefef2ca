package io.skywatch.executor.hardware;

import io.skywatch.protocol.CommandOp;
import java.util.Locale;

/**
 * Tag selecting the capability a command runs against.
 */
public enum HardwareKind {
    SWITCH,
    VNA,
    SENSOR,
    CORRELATOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HardwareKind forOp(CommandOp op) {
        return switch (op) {
            case SWITCH -> SWITCH;
            case VNA -> VNA;
            case SENSOR -> SENSOR;
            case CORRELATOR -> CORRELATOR;
        };
    }
}
