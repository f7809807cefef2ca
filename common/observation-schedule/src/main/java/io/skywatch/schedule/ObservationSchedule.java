package io.skywatch.schedule;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single generated cycle consumed cyclically. Instances are immutable; all positions are
 * expressed as {@link ScheduleCursor}s owned by the caller.
 */
public final class ObservationSchedule {

    private final List<ScheduleStep> cycle;
    private final Duration cycleLength;
    private final String fingerprint;

    public ObservationSchedule(List<ScheduleStep> cycle) {
        Objects.requireNonNull(cycle, "cycle");
        if (cycle.isEmpty()) {
            throw new InvalidScheduleException("Schedule cycle is empty");
        }
        this.cycle = List.copyOf(cycle);
        this.cycleLength = this.cycle.stream().map(ScheduleStep::duration).reduce(Duration.ZERO, Duration::plus);
        this.fingerprint = this.cycle.stream().map(ScheduleStep::toString).collect(Collectors.joining(""));
    }

    public List<ScheduleStep> cycle() {
        return cycle;
    }

    public int size() {
        return cycle.size();
    }

    public Duration cycleLength() {
        return cycleLength;
    }

    /**
     * Stable textual form of the cycle, e.g. {@code (sky,10)(load,5)}. Two schedules with the same
     * fingerprint yield the same steps at every cursor.
     */
    public String fingerprint() {
        return fingerprint;
    }

    public ScheduleStep stepAt(ScheduleCursor cursor) {
        return cycle.get(normalize(cursor).index());
    }

    public ScheduleCursor advance(ScheduleCursor cursor) {
        ScheduleCursor current = normalize(cursor);
        int next = current.index() + 1;
        if (next >= cycle.size()) {
            return new ScheduleCursor(current.cycle() + 1, 0);
        }
        return new ScheduleCursor(current.cycle(), next);
    }

    /**
     * Steps from {@code cursor} (inclusive) to the end of its cycle.
     */
    public List<ScheduleStep> remainingFrom(ScheduleCursor cursor) {
        return cycle.subList(normalize(cursor).index(), cycle.size());
    }

    /**
     * Maps an index past the end of the cycle to the start of the following cycle.
     */
    public ScheduleCursor normalize(ScheduleCursor cursor) {
        Objects.requireNonNull(cursor, "cursor");
        if (cursor.index() < cycle.size()) {
            return cursor;
        }
        return new ScheduleCursor(cursor.cycle() + 1, 0);
    }

    @Override
    public String toString() {
        return "ObservationSchedule" + cycle + " length=" + cycleLength.toSeconds() + "s";
    }
}
