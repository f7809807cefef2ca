package io.skywatch.bus;

import java.util.Objects;

/**
 * Structured description of a failed bus call.
 */
public record BusError(BusErrorCause cause, String operation, String message, int attempts) {

    public BusError {
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(operation, "operation");
        message = message == null || message.isBlank() ? cause.name().toLowerCase() : message;
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    public String code() {
        return cause.name().toLowerCase().replace('_', '-');
    }

    public String describe() {
        return operation + " failed (" + code() + ", attempts=" + attempts + "): " + message;
    }
}
