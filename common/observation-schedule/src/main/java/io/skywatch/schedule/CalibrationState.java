package io.skywatch.schedule;

import java.util.Locale;

/**
 * Calibration states an observation cycle moves through.
 */
public enum CalibrationState {
    SKY,
    LOAD,
    NOISE,
    VNA,
    CORRELATOR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CalibrationState fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleException("Calibration state must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CalibrationState state : values()) {
            if (state.wireName().equals(normalized)) {
                return state;
            }
        }
        throw new InvalidScheduleException("Unknown calibration state '" + value + "'");
    }
}
