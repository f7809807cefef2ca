package io.skywatch.schedule;

import static io.skywatch.schedule.CalibrationState.LOAD;
import static io.skywatch.schedule.CalibrationState.NOISE;
import static io.skywatch.schedule.CalibrationState.SKY;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObservationScheduleTest {

    private final ObservationSchedule schedule = ScheduleSpec.of(
        Map.of(SKY, 2, LOAD, 1, NOISE, 1),
        Map.of(SKY, Duration.ofSeconds(10), LOAD, Duration.ofSeconds(5), NOISE, Duration.ofSeconds(5)),
        List.of(SKY, LOAD, NOISE)).toSchedule();

    @Test
    void wrapsAroundIntoTheNextCycle() {
        ScheduleCursor cursor = ScheduleCursor.START;
        List<CalibrationState> visited = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            visited.add(schedule.stepAt(cursor).state());
            cursor = schedule.advance(cursor);
        }

        assertThat(visited).containsExactly(SKY, SKY, LOAD, NOISE, SKY, SKY);
        assertThat(cursor).isEqualTo(new ScheduleCursor(1, 2));
    }

    @Test
    void resumingMidCycleReproducesRemainingSteps() {
        ScheduleCursor resumed = new ScheduleCursor(4, 2);

        assertThat(schedule.remainingFrom(resumed))
            .extracting(ScheduleStep::state)
            .containsExactly(LOAD, NOISE);
        assertThat(schedule.remainingFrom(resumed)).isEqualTo(schedule.cycle().subList(2, 4));
    }

    @Test
    void cursorPastTheEndStartsTheNextCycle() {
        ScheduleCursor stale = new ScheduleCursor(3, 9);

        assertThat(schedule.normalize(stale)).isEqualTo(new ScheduleCursor(4, 0));
        assertThat(schedule.stepAt(stale).state()).isEqualTo(SKY);
    }
}
