package io.skywatch.orchestrator.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of the ground-side state machine. {@link #STOPPED} is terminal.
 */
public enum OrchestratorState {
    INIT(0),
    RUNNING(1),
    PAUSED(2),
    DISCONNECTED(3),
    STOPPED(4);

    private final int code;

    OrchestratorState(int code) {
        this.code = code;
    }

    /**
     * Numeric form exported as a gauge.
     */
    public int code() {
        return code;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean canTransitionTo(OrchestratorState next) {
        return allowedTargets().contains(next);
    }

    public boolean isTerminal() {
        return this == STOPPED;
    }

    private Set<OrchestratorState> allowedTargets() {
        return switch (this) {
            case INIT -> EnumSet.of(RUNNING, PAUSED, DISCONNECTED, STOPPED);
            case RUNNING -> EnumSet.of(PAUSED, DISCONNECTED, STOPPED);
            case PAUSED -> EnumSet.of(RUNNING, STOPPED);
            case DISCONNECTED -> EnumSet.of(RUNNING, PAUSED, STOPPED);
            case STOPPED -> EnumSet.noneOf(OrchestratorState.class);
        };
    }
}
