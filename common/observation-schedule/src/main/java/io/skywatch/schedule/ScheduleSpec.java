package io.skywatch.schedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Full cycle layout: an optional leading VNA block followed by the calibration block repeated
 * {@code blockRepeat} times.
 *
 * @param counts repeat count per state inside the calibration block
 * @param durations dwell per state
 * @param order group order inside the calibration block
 * @param vnaCount number of VNA steps opening each cycle, 0 for none
 * @param blockRepeat how many times the calibration block repeats per cycle
 * @param expectedCycle cycle length the generated steps must add up to, or {@code null} to skip the check
 */
public record ScheduleSpec(Map<CalibrationState, Integer> counts,
                           Map<CalibrationState, Duration> durations,
                           List<CalibrationState> order,
                           int vnaCount,
                           int blockRepeat,
                           Duration expectedCycle) {

    public ScheduleSpec {
        counts = counts == null ? Map.of() : Collections.unmodifiableMap(copy(counts));
        durations = durations == null ? Map.of() : Collections.unmodifiableMap(copy(durations));
        order = order == null ? List.of() : List.copyOf(order);
        if (vnaCount < 0) {
            throw new InvalidScheduleException("vnaCount must be >= 0");
        }
        if (blockRepeat < 0) {
            throw new InvalidScheduleException("blockRepeat must be >= 0");
        }
    }

    public static ScheduleSpec of(Map<CalibrationState, Integer> counts,
                                  Map<CalibrationState, Duration> durations,
                                  List<CalibrationState> order) {
        return new ScheduleSpec(counts, durations, order, 0, 1, null);
    }

    /**
     * Generates and validates the cycle.
     *
     * @throws InvalidScheduleException when the layout is inconsistent, empty, or its length
     *     differs from {@code expectedCycle}
     */
    public ObservationSchedule toSchedule() {
        if (vnaCount > 0 && order.contains(CalibrationState.VNA)) {
            throw new InvalidScheduleException("VNA is configured both as a leading block and inside the calibration block");
        }
        ScheduleGenerator.validate(counts, order);
        List<CalibrationState> block = ScheduleGenerator.expand(counts, order);
        List<CalibrationState> states = new ArrayList<>();
        for (int i = 0; i < vnaCount; i++) {
            states.add(CalibrationState.VNA);
        }
        for (int r = 0; r < blockRepeat; r++) {
            states.addAll(block);
        }
        ObservationSchedule schedule = new ObservationSchedule(ScheduleGenerator.index(states, durations));
        if (expectedCycle != null && !expectedCycle.equals(schedule.cycleLength())) {
            throw new InvalidScheduleException("Cycle adds up to " + schedule.cycleLength().toSeconds()
                + "s but " + expectedCycle.toSeconds() + "s was configured");
        }
        return schedule;
    }

    private static <V> Map<CalibrationState, V> copy(Map<CalibrationState, V> source) {
        Map<CalibrationState, V> copy = new EnumMap<>(CalibrationState.class);
        copy.putAll(source);
        return copy;
    }
}
