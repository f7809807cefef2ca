package io.skywatch.bus;

import java.util.Objects;

/**
 * Retry and retention behaviour of a {@link StreamBus}.
 */
public record BusSettings(int publishAttempts, ExponentialBackoff backoff, StreamRetention retention) {

    public static final BusSettings DEFAULTS = new BusSettings(3, ExponentialBackoff.DEFAULT, StreamRetention.UNBOUNDED);

    public BusSettings {
        if (publishAttempts < 1) {
            throw new IllegalArgumentException("publishAttempts must be >= 1");
        }
        Objects.requireNonNull(backoff, "backoff");
        retention = retention == null ? StreamRetention.UNBOUNDED : retention;
    }
}
