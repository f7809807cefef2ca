package io.skywatch.bus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approximate length caps keyed by stream-name prefix; 0 means unbounded.
 */
public record StreamRetention(Map<String, Long> maxLengthByPrefix) {

    public static final StreamRetention UNBOUNDED = new StreamRetention(Map.of());

    public StreamRetention {
        maxLengthByPrefix = maxLengthByPrefix == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(maxLengthByPrefix));
        maxLengthByPrefix.forEach((prefix, max) -> {
            if (max == null || max < 0) {
                throw new IllegalArgumentException("max length for '" + prefix + "' must be >= 0");
            }
        });
    }

    public long maxLengthFor(String stream) {
        long best = 0L;
        int bestLength = -1;
        for (Map.Entry<String, Long> entry : maxLengthByPrefix.entrySet()) {
            String prefix = entry.getKey();
            if (stream.startsWith(prefix) && prefix.length() > bestLength) {
                best = entry.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }
}
