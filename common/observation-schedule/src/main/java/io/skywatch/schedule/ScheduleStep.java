package io.skywatch.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * One dwell of the cycle. {@code repeatIndex} counts earlier steps of the same state within the
 * cycle, starting at 0.
 */
public record ScheduleStep(CalibrationState state, Duration duration, int repeatIndex) {

    public ScheduleStep {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be > 0");
        }
        if (repeatIndex < 0) {
            throw new IllegalArgumentException("repeatIndex must be >= 0");
        }
    }

    @Override
    public String toString() {
        return "(" + state.wireName() + "," + duration.toSeconds() + ")";
    }
}
