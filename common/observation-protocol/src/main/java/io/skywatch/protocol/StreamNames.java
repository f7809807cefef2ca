package io.skywatch.protocol;

/**
 * Naming of the streams and keys shared by the orchestrator and the executor.
 */
public final class StreamNames {

    public static final String CONTROL_PREFIX = "ctrl:";
    public static final String STATUS_PREFIX = "status:";
    public static final String DATA_PREFIX = "data:";
    public static final String HEARTBEAT_PREFIX = "heartbeat:";
    public static final String CAPABILITIES_PREFIX = "capabilities:";
    public static final String CORRELATOR_CONFIG = "correlator:config";
    public static final String VNA_DATA = DATA_PREFIX + "vna";

    private StreamNames() {
    }

    public static String control(String target) {
        return CONTROL_PREFIX + requireName(target, "target");
    }

    public static String status(String target) {
        return STATUS_PREFIX + requireName(target, "target");
    }

    public static String data(String sensor) {
        return DATA_PREFIX + requireName(sensor, "sensor");
    }

    public static String heartbeat(String target) {
        return HEARTBEAT_PREFIX + requireName(target, "target");
    }

    public static String capabilities(String target) {
        return CAPABILITIES_PREFIX + requireName(target, "target");
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(field + " must not contain ':' (was '" + value + "')");
        }
        return value.trim();
    }
}
