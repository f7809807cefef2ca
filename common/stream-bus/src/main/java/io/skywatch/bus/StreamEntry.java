package io.skywatch.bus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry read back from a stream.
 */
public record StreamEntry(String stream, EntryId id, Map<String, String> fields) {

    public StreamEntry {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(id, "id");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public String field(String name) {
        return fields.get(name);
    }

    /**
     * Time the bus accepted the entry, derived from the id.
     */
    public Instant appendedAt() {
        return Instant.ofEpochMilli(id.millis());
    }
}
