package io.skywatch.executor.hardware;

import java.util.Locale;
import java.util.Map;

/**
 * One S11 measurement request. {@code mode} is {@code ant} (antenna) or {@code rec} (receiver).
 */
public record VnaSettings(String mode, double powerDbm, double startHz, double stopHz, int points, double ifBandwidthHz) {

    public VnaSettings {
        if (mode == null || !(mode.equals("ant") || mode.equals("rec"))) {
            throw new IllegalArgumentException("Unknown VNA mode '" + mode + "'; must be 'ant' or 'rec'");
        }
        if (startHz <= 0 || stopHz <= startHz) {
            throw new IllegalArgumentException("VNA frequency range must satisfy 0 < start < stop");
        }
        if (points < 2) {
            throw new IllegalArgumentException("VNA points must be >= 2");
        }
        if (ifBandwidthHz <= 0) {
            throw new IllegalArgumentException("VNA IF bandwidth must be > 0");
        }
    }

    /**
     * Reads the settings for {@code mode} from command args. {@code power_dbm} may be a number or a
     * per-mode mapping.
     */
    public static VnaSettings fromArgs(String mode, Map<String, Object> args) {
        String normalized = mode == null ? null : mode.trim().toLowerCase(Locale.ROOT);
        Object power = args.get("power_dbm");
        if (power instanceof Map<?, ?> perMode) {
            power = perMode.get(normalized);
        }
        return new VnaSettings(
            normalized,
            number(power, "power_dbm"),
            number(args.get("fstart_hz"), "fstart_hz"),
            number(args.get("fstop_hz"), "fstop_hz"),
            (int) number(args.get("npoints"), "npoints"),
            number(args.get("ifbw_hz"), "ifbw_hz"));
    }

    private static double number(Object value, String name) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("VNA setting '" + name + "' is not a number: " + text, ex);
            }
        }
        throw new IllegalArgumentException("VNA setting '" + name + "' is missing");
    }
}
