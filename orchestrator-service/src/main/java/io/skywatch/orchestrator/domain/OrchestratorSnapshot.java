package io.skywatch.orchestrator.domain;

import io.skywatch.protocol.StatusRecord;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of the state machine, republished after every loop iteration for readers on
 * other threads.
 */
public record OrchestratorSnapshot(String target,
                                   OrchestratorState state,
                                   long cycle,
                                   int index,
                                   String currentStep,
                                   Duration currentDuration,
                                   long nextSequence,
                                   OutstandingCommand outstanding,
                                   StatusRecord lastStatus,
                                   boolean pauseRequested,
                                   Instant dwellUntil,
                                   String scheduleFingerprint,
                                   Duration cycleLength,
                                   String lastBusError,
                                   Instant updatedAt) {
}
