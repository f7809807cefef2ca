package io.skywatch.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Measurement published on a {@code data:{source}} stream.
 */
public record DataRecord(String source, Map<String, Object> values, Instant recordedAt) {

    public DataRecord {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        Objects.requireNonNull(recordedAt, "recordedAt");
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
