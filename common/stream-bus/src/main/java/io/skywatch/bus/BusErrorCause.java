package io.skywatch.bus;

public enum BusErrorCause {
    UNAVAILABLE,
    TIMEOUT,
    PROTOCOL,
    CLOSED,
    INVALID_REQUEST,
    INTERNAL;

    /**
     * Whether backing off and trying again can help.
     */
    public boolean isTransient() {
        return this == UNAVAILABLE || this == TIMEOUT || this == PROTOCOL;
    }
}
