package io.skywatch.executor.hardware;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured result of one hardware call. A failed outcome carries a human-readable cause.
 */
public record HardwareOutcome(HardwareKind kind, boolean success, String cause, Map<String, Object> detail) {

    public HardwareOutcome {
        Objects.requireNonNull(kind, "kind");
        if (!success && (cause == null || cause.isBlank())) {
            throw new IllegalArgumentException("failed outcome needs a cause");
        }
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static HardwareOutcome success(HardwareKind kind, Map<String, Object> detail) {
        return new HardwareOutcome(kind, true, null, detail);
    }

    public static HardwareOutcome failure(HardwareKind kind, String cause) {
        return new HardwareOutcome(kind, false, cause, Map.of());
    }
}
