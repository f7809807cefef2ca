package io.skywatch.executor.hardware;

import java.util.Objects;

/**
 * Raised by a driver when the device did not perform the requested operation. The message is
 * reported as the status cause.
 */
public class HardwareFaultException extends RuntimeException {

    private final HardwareKind kind;

    public HardwareFaultException(HardwareKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HardwareFaultException(HardwareKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HardwareKind kind() {
        return kind;
    }
}
