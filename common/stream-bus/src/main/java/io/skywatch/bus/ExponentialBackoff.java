package io.skywatch.bus;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential delay sequence. Attempt numbers start at 1.
 */
public record ExponentialBackoff(Duration initial, Duration max, double multiplier) {

    public static final ExponentialBackoff DEFAULT =
        new ExponentialBackoff(Duration.ofMillis(200), Duration.ofSeconds(10), 2.0);

    public ExponentialBackoff {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(max, "max");
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be >= 0");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must be >= initial backoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    public Duration delayFor(int attempt) {
        if (attempt <= 1) {
            return initial;
        }
        double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }
}
