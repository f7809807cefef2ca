package io.skywatch.orchestrator.domain;

import io.skywatch.protocol.Command;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The single command awaiting its status.
 *
 * @param sequence sequence assigned at issue time, reused for every re-delivery
 * @param op wire name of the operation
 * @param args operation arguments
 * @param scheduleState wire name of the schedule state the command realises
 * @param issuedAt when the sequence was assigned
 * @param deliveries publications of this sequence since issue or the last reconnect
 * @param errorAttempts error statuses already received for the current schedule step
 * @param publishedAt last successful publication, {@code null} until first published
 */
public record OutstandingCommand(long sequence,
                                 String op,
                                 Map<String, Object> args,
                                 String scheduleState,
                                 Instant issuedAt,
                                 int deliveries,
                                 int errorAttempts,
                                 Instant publishedAt) {

    public OutstandingCommand {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        Objects.requireNonNull(op, "op");
        args = args == null ? Map.of() : Map.copyOf(args);
        Objects.requireNonNull(scheduleState, "scheduleState");
        Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public static OutstandingCommand issue(long sequence, PlannedCommand planned, String scheduleState,
                                           int errorAttempts, Instant now) {
        return new OutstandingCommand(sequence, planned.op().wireName(), planned.args(), scheduleState, now,
            0, errorAttempts, null);
    }

    public boolean published() {
        return publishedAt != null;
    }

    public OutstandingCommand delivered(Instant at) {
        return new OutstandingCommand(sequence, op, args, scheduleState, issuedAt, deliveries + 1, errorAttempts, at);
    }

    /**
     * Forgets earlier deliveries so the command can be re-published with a fresh budget.
     */
    public OutstandingCommand rearmed() {
        return new OutstandingCommand(sequence, op, args, scheduleState, issuedAt, 0, errorAttempts, null);
    }

    public Command toCommand() {
        return new Command(sequence, op, args, issuedAt);
    }
}
