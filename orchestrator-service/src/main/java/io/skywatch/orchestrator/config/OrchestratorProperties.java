package io.skywatch.orchestrator.config;

import io.skywatch.schedule.CalibrationState;
import io.skywatch.schedule.ScheduleSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Ground-side settings bound from {@code skywatch.orchestrator.*}.
 */
@Validated
@ConfigurationProperties(prefix = "skywatch.orchestrator")
public class OrchestratorProperties {

    @NotBlank
    private String target = "panda";
    @Valid
    private final Schedule schedule = new Schedule();
    @NotNull
    private Duration commandTimeout = Duration.ofSeconds(30);
    @Min(1)
    private int maxAttempts = 3;
    @Valid
    private final Liveness liveness = new Liveness();
    @Valid
    private final Loop loop = new Loop();
    @NotNull
    private Path checkpointFile = Path.of("state", "orchestrator-checkpoint.json");
    @Valid
    private final Vna vna = new Vna();
    @Valid
    private final Correlator correlator = new Correlator();
    @Valid
    private final Dashboard dashboard = new Dashboard();

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target == null ? null : target.trim();
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Liveness getLiveness() {
        return liveness;
    }

    public Loop getLoop() {
        return loop;
    }

    public Path getCheckpointFile() {
        return checkpointFile;
    }

    public void setCheckpointFile(Path checkpointFile) {
        this.checkpointFile = checkpointFile;
    }

    public Vna getVna() {
        return vna;
    }

    public Correlator getCorrelator() {
        return correlator;
    }

    public Dashboard getDashboard() {
        return dashboard;
    }

    /**
     * Cycle layout keyed by state wire names ({@code sky}, {@code load}, {@code noise}, {@code vna},
     * {@code correlator}).
     */
    public static class Schedule {

        private Map<String, Integer> counts = new LinkedHashMap<>(Map.of("sky", 2, "load", 1, "noise", 1));
        private Map<String, Duration> durations = new LinkedHashMap<>(Map.of(
            "sky", Duration.ofSeconds(10),
            "load", Duration.ofSeconds(5),
            "noise", Duration.ofSeconds(5),
            "vna", Duration.ofSeconds(60),
            "correlator", Duration.ofSeconds(10)));
        @NotEmpty
        private List<String> order = new ArrayList<>(List.of("sky", "load", "noise"));
        @Min(0)
        private int vnaCount;
        @Min(0)
        private int blockRepeat = 1;
        /**
         * Cycle length the steps must add up to; unset skips the check.
         */
        private Duration expectedCycle;

        public Map<String, Integer> getCounts() {
            return counts;
        }

        public void setCounts(Map<String, Integer> counts) {
            this.counts = counts == null ? new LinkedHashMap<>() : new LinkedHashMap<>(counts);
        }

        public Map<String, Duration> getDurations() {
            return durations;
        }

        public void setDurations(Map<String, Duration> durations) {
            this.durations = durations == null ? new LinkedHashMap<>() : new LinkedHashMap<>(durations);
        }

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order == null ? new ArrayList<>() : new ArrayList<>(order);
        }

        public int getVnaCount() {
            return vnaCount;
        }

        public void setVnaCount(int vnaCount) {
            this.vnaCount = vnaCount;
        }

        public int getBlockRepeat() {
            return blockRepeat;
        }

        public void setBlockRepeat(int blockRepeat) {
            this.blockRepeat = blockRepeat;
        }

        public Duration getExpectedCycle() {
            return expectedCycle;
        }

        public void setExpectedCycle(Duration expectedCycle) {
            this.expectedCycle = expectedCycle;
        }

        /**
         * @throws io.skywatch.schedule.InvalidScheduleException for unknown state names
         */
        public ScheduleSpec toScheduleSpec() {
            Map<CalibrationState, Integer> stateCounts = new EnumMap<>(CalibrationState.class);
            counts.forEach((name, count) -> stateCounts.put(CalibrationState.fromWire(name), count));
            Map<CalibrationState, Duration> stateDurations = new EnumMap<>(CalibrationState.class);
            durations.forEach((name, duration) -> stateDurations.put(CalibrationState.fromWire(name), duration));
            List<CalibrationState> stateOrder = new ArrayList<>(order.size());
            for (String name : order) {
                stateOrder.add(CalibrationState.fromWire(name));
            }
            return new ScheduleSpec(stateCounts, stateDurations, stateOrder, vnaCount, blockRepeat, expectedCycle);
        }
    }

    public static class Liveness {

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(5);
        @Min(1)
        private int missedThreshold = 3;

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getMissedThreshold() {
            return missedThreshold;
        }

        public void setMissedThreshold(int missedThreshold) {
            this.missedThreshold = missedThreshold;
        }
    }

    public static class Loop {

        @NotNull
        private Duration blockTimeout = Duration.ofSeconds(1);
        @NotNull
        private Duration backoffInitial = Duration.ofMillis(200);
        @NotNull
        private Duration backoffMax = Duration.ofSeconds(10);

        public Duration getBlockTimeout() {
            return blockTimeout;
        }

        public void setBlockTimeout(Duration blockTimeout) {
            this.blockTimeout = blockTimeout;
        }

        public Duration getBackoffInitial() {
            return backoffInitial;
        }

        public void setBackoffInitial(Duration backoffInitial) {
            this.backoffInitial = backoffInitial;
        }

        public Duration getBackoffMax() {
            return backoffMax;
        }

        public void setBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
        }
    }

    /**
     * S11 scan settings sent with every VNA step.
     */
    public static class Vna {

        @NotEmpty
        private List<String> modes = new ArrayList<>(List.of("ant", "rec"));
        private double powerAntDbm = 0.0;
        private double powerRecDbm = -40.0;
        private double startHz = 1e6;
        private double stopHz = 250e6;
        @Min(2)
        private int points = 1000;
        private double ifBandwidthHz = 100.0;

        public List<String> getModes() {
            return modes;
        }

        public void setModes(List<String> modes) {
            this.modes = modes == null ? new ArrayList<>() : new ArrayList<>(modes);
        }

        public double getPowerAntDbm() {
            return powerAntDbm;
        }

        public void setPowerAntDbm(double powerAntDbm) {
            this.powerAntDbm = powerAntDbm;
        }

        public double getPowerRecDbm() {
            return powerRecDbm;
        }

        public void setPowerRecDbm(double powerRecDbm) {
            this.powerRecDbm = powerRecDbm;
        }

        public double getStartHz() {
            return startHz;
        }

        public void setStartHz(double startHz) {
            this.startHz = startHz;
        }

        public double getStopHz() {
            return stopHz;
        }

        public void setStopHz(double stopHz) {
            this.stopHz = stopHz;
        }

        public int getPoints() {
            return points;
        }

        public void setPoints(int points) {
            this.points = points;
        }

        public double getIfBandwidthHz() {
            return ifBandwidthHz;
        }

        public void setIfBandwidthHz(double ifBandwidthHz) {
            this.ifBandwidthHz = ifBandwidthHz;
        }

        public Map<String, Object> toArgs() {
            Map<String, Object> power = new LinkedHashMap<>();
            power.put("ant", powerAntDbm);
            power.put("rec", powerRecDbm);
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("modes", List.copyOf(modes));
            args.put("power_dbm", power);
            args.put("fstart_hz", startHz);
            args.put("fstop_hz", stopHz);
            args.put("npoints", points);
            args.put("ifbw_hz", ifBandwidthHz);
            return args;
        }
    }

    public static class Correlator {

        private Map<String, String> params = new LinkedHashMap<>();

        public Map<String, String> getParams() {
            return params;
        }

        public void setParams(Map<String, String> params) {
            this.params = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        }
    }

    public static class Dashboard {

        private List<String> sensors = new ArrayList<>(List.of("imu", "therm", "peltier", "lidar"));

        public List<String> getSensors() {
            return sensors;
        }

        public void setSensors(List<String> sensors) {
            this.sensors = sensors == null ? new ArrayList<>() : new ArrayList<>(sensors);
        }
    }
}
