package io.skywatch.schedule;

/**
 * Position in the infinite schedule: the cycle number and the index of the step within it.
 */
public record ScheduleCursor(long cycle, int index) {

    public static final ScheduleCursor START = new ScheduleCursor(0L, 0);

    public ScheduleCursor {
        if (cycle < 0 || index < 0) {
            throw new IllegalArgumentException("cursor components must be >= 0");
        }
    }
}
