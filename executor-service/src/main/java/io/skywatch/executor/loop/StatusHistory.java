package io.skywatch.executor.loop;

import io.skywatch.protocol.StatusRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Most recent status records by sequence, evicting the oldest beyond {@code capacity}.
 */
final class StatusHistory {

    private final int capacity;
    private final LinkedHashMap<Long, StatusRecord> records;

    StatusHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.records = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, StatusRecord> eldest) {
                return size() > StatusHistory.this.capacity;
            }
        };
    }

    void record(StatusRecord status) {
        records.put(status.sequence(), status);
    }

    Optional<StatusRecord> find(long sequence) {
        return Optional.ofNullable(records.get(sequence));
    }

    List<StatusRecord> snapshot() {
        return new ArrayList<>(records.values());
    }

    String describeRange() {
        if (records.isEmpty()) {
            return "empty";
        }
        List<Long> keys = new ArrayList<>(records.keySet());
        return keys.get(0) + ".." + keys.get(keys.size() - 1);
    }
}
