package io.skywatch.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Instruction published by the orchestrator on {@code ctrl:{target}}.
 * <p>
 * {@code sequence} is strictly increasing per target and starts at 1.
 */
public record Command(long sequence, String op, Map<String, Object> args, Instant issuedAt) {

    public Command {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        if (op == null || op.isBlank()) {
            throw new IllegalArgumentException("op must not be null or blank");
        }
        Objects.requireNonNull(issuedAt, "issuedAt");
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static Command of(long sequence, CommandOp op, Map<String, Object> args, Instant issuedAt) {
        return new Command(sequence, Objects.requireNonNull(op, "op").wireName(), args, issuedAt);
    }

    /**
     * Copy of this command carrying a new sequence, used when a failed state is attempted again.
     */
    public Command withSequence(long nextSequence, Instant reissuedAt) {
        return new Command(nextSequence, op, args, reissuedAt);
    }
}
