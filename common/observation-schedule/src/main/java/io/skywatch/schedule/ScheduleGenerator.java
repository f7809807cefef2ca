package io.skywatch.schedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one observation cycle from per-state repeat counts and dwell durations.
 */
public final class ScheduleGenerator {

    private ScheduleGenerator() {
    }

    /**
     * For each state in {@code order}, emits {@code counts[state]} steps of
     * {@code durations[state]}, keeping the order of the groups. A state without a count
     * contributes nothing.
     *
     * @throws InvalidScheduleException when a count is negative, a state with steps has no
     *     positive duration, a counted state is missing from {@code order}, {@code order} repeats
     *     a state, or the cycle comes out empty
     */
    public static List<ScheduleStep> makeSchedule(Map<CalibrationState, Integer> counts,
                                                  Map<CalibrationState, Duration> durations,
                                                  List<CalibrationState> order) {
        if (durations == null) {
            throw new InvalidScheduleException("durations are required");
        }
        validate(counts, order);
        return index(expand(counts, order), durations);
    }

    static void validate(Map<CalibrationState, Integer> counts, List<CalibrationState> order) {
        if (counts == null || order == null) {
            throw new InvalidScheduleException("counts and order are required");
        }
        Set<CalibrationState> seen = EnumSet.noneOf(CalibrationState.class);
        for (CalibrationState state : order) {
            if (state == null) {
                throw new InvalidScheduleException("order must not contain null states");
            }
            if (!seen.add(state)) {
                throw new InvalidScheduleException("State '" + state.wireName() + "' appears twice in order");
            }
        }
        for (Map.Entry<CalibrationState, Integer> entry : counts.entrySet()) {
            int count = countOf(counts, entry.getKey());
            if (count > 0 && !seen.contains(entry.getKey())) {
                throw new InvalidScheduleException(
                    "State '" + entry.getKey().wireName() + "' has a repeat count but is not in order");
            }
        }
    }

    static List<CalibrationState> expand(Map<CalibrationState, Integer> counts, List<CalibrationState> order) {
        List<CalibrationState> states = new ArrayList<>();
        for (CalibrationState state : order) {
            int count = countOf(counts, state);
            for (int i = 0; i < count; i++) {
                states.add(state);
            }
        }
        return states;
    }

    /**
     * Attaches durations and repeat indexes to an already ordered list of states.
     */
    static List<ScheduleStep> index(List<CalibrationState> states, Map<CalibrationState, Duration> durations) {
        if (states.isEmpty()) {
            throw new InvalidScheduleException("Schedule cycle is empty; at least one state needs a positive count");
        }
        Map<CalibrationState, Integer> occurrences = new EnumMap<>(CalibrationState.class);
        List<ScheduleStep> steps = new ArrayList<>(states.size());
        for (CalibrationState state : states) {
            Duration duration = durations.get(state);
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new InvalidScheduleException(
                    "State '" + state.wireName() + "' needs a positive duration, got " + duration);
            }
            int repeatIndex = occurrences.merge(state, 1, Integer::sum) - 1;
            steps.add(new ScheduleStep(state, duration, repeatIndex));
        }
        return List.copyOf(steps);
    }

    static int countOf(Map<CalibrationState, Integer> counts, CalibrationState state) {
        Integer count = counts.get(state);
        if (count == null) {
            return 0;
        }
        if (count < 0) {
            throw new InvalidScheduleException(
                "State '" + state.wireName() + "' has negative repeat count " + count);
        }
        return count;
    }
}
