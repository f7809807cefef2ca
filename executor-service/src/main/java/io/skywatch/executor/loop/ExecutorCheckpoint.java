package io.skywatch.executor.loop;

import io.skywatch.protocol.CommandResult;
import io.skywatch.protocol.StatusRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable executor state: read cursor on the control stream, last applied sequence and the recent
 * status records kept for idempotent replay.
 */
public record ExecutorCheckpoint(String lastEntryId, long lastApplied, List<RecordedStatus> history, Instant updatedAt) {

    public ExecutorCheckpoint {
        if (lastApplied < 0) {
            throw new IllegalArgumentException("lastApplied must be >= 0");
        }
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Serialised form of a {@link StatusRecord}.
     */
    public record RecordedStatus(long sequence, String result, Map<String, Object> detail, Instant emittedAt) {

        static RecordedStatus from(StatusRecord status) {
            return new RecordedStatus(status.sequence(), status.result().wireName(), status.detail(), status.emittedAt());
        }

        StatusRecord toStatus() {
            return new StatusRecord(sequence, CommandResult.fromWire(result), detail, emittedAt);
        }
    }
}
