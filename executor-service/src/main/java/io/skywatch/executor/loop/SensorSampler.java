package io.skywatch.executor.loop;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idle-time sampling of the configured sensors. Runs on the consumption loop thread only.
 */
public class SensorSampler {

    private static final Logger log = LoggerFactory.getLogger(SensorSampler.class);

    private final CommandDispatcher dispatcher;
    private final List<String> sensorIds;
    private final Duration interval;
    private final Clock clock;
    private Instant lastSample;

    public SensorSampler(CommandDispatcher dispatcher, List<String> sensorIds, Duration interval, Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.sensorIds = List.copyOf(sensorIds);
        this.interval = Objects.requireNonNull(interval, "interval");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Samples every sensor when the interval has elapsed since the previous round.
     *
     * @return the number of readings published
     */
    public int sampleIfDue() {
        if (interval.isZero() || interval.isNegative() || sensorIds.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        if (lastSample != null && now.isBefore(lastSample.plus(interval))) {
            return 0;
        }
        lastSample = now;
        List<String> available = dispatcher.sensorIds();
        int published = 0;
        for (String id : sensorIds) {
            if (!available.contains(id)) {
                log.debug("Sensor {} not available; skipping sample", id);
                continue;
            }
            if (dispatcher.sampleSensor(id)) {
                published++;
            }
        }
        log.debug("Sampled {} of {} sensors", published, sensorIds.size());
        return published;
    }
}
