package io.skywatch.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome reported by the executor on {@code status:{target}}. Sequence 0 marks an unsolicited
 * status that does not answer any command.
 */
public record StatusRecord(long sequence, CommandResult result, Map<String, Object> detail, Instant emittedAt) {

    public static final long UNSOLICITED = 0L;
    public static final String CAUSE = "cause";

    public StatusRecord {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(emittedAt, "emittedAt");
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static StatusRecord ok(long sequence, Map<String, Object> detail, Instant emittedAt) {
        return new StatusRecord(sequence, CommandResult.OK, detail, emittedAt);
    }

    public static StatusRecord error(long sequence, String cause, Map<String, Object> extra, Instant emittedAt) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(CAUSE, cause == null || cause.isBlank() ? "unknown" : cause);
        if (extra != null) {
            extra.forEach(detail::putIfAbsent);
        }
        return new StatusRecord(sequence, CommandResult.ERROR, detail, emittedAt);
    }

    public boolean isOk() {
        return result == CommandResult.OK;
    }

    public boolean isUnsolicited() {
        return sequence == UNSOLICITED;
    }

    public String cause() {
        Object cause = detail.get(CAUSE);
        return cause == null ? null : cause.toString();
    }
}
