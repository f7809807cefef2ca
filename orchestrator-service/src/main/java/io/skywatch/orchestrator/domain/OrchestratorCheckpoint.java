package io.skywatch.orchestrator.domain;

import java.time.Instant;

/**
 * Durable orchestrator position. Saved before every command publication so a sequence is never
 * handed out twice, and after every cursor move so a restart resumes instead of restarting the
 * cycle.
 *
 * @param cycle schedule cycle of the cursor
 * @param index step index of the cursor
 * @param nextSequence next sequence to assign
 * @param outstanding command awaiting status, or {@code null}
 * @param scheduleFingerprint fingerprint of the schedule the cursor refers to
 * @param statusCursor last status entry id consumed
 * @param pauseRequested whether an operator pause is in force
 * @param updatedAt save time
 */
public record OrchestratorCheckpoint(long cycle,
                                     int index,
                                     long nextSequence,
                                     OutstandingCommand outstanding,
                                     String scheduleFingerprint,
                                     String statusCursor,
                                     boolean pauseRequested,
                                     Instant updatedAt) {
}
