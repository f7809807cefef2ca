package io.skywatch.bus;

import java.util.Objects;

/**
 * Raised when a caller decides a {@link BusError} cannot be absorbed, typically during startup.
 */
public class BusUnavailableException extends RuntimeException {

    private final BusError error;

    public BusUnavailableException(BusError error) {
        super(Objects.requireNonNull(error, "error").describe());
        this.error = error;
    }

    public BusError error() {
        return error;
    }
}
