package io.skywatch.executor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Remote executor settings bound from {@code skywatch.executor.*}.
 */
@Validated
@ConfigurationProperties(prefix = "skywatch.executor")
public class ExecutorProperties {

    @NotBlank
    private String target = "panda";
    @Valid
    private final Heartbeat heartbeat = new Heartbeat();
    @Valid
    private final Loop loop = new Loop();
    @NotNull
    private Duration hardwareTimeout = Duration.ofSeconds(10);
    @NotNull
    private Path checkpointFile = Path.of("state", "executor-checkpoint.json");
    @Min(1)
    private int statusHistory = 64;
    @Valid
    private final Sensors sensors = new Sensors();
    @Valid
    private final Simulation simulation = new Simulation();

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target == null ? null : target.trim();
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public Loop getLoop() {
        return loop;
    }

    public Duration getHardwareTimeout() {
        return hardwareTimeout;
    }

    public void setHardwareTimeout(Duration hardwareTimeout) {
        this.hardwareTimeout = hardwareTimeout;
    }

    public Path getCheckpointFile() {
        return checkpointFile;
    }

    public void setCheckpointFile(Path checkpointFile) {
        this.checkpointFile = checkpointFile;
    }

    public int getStatusHistory() {
        return statusHistory;
    }

    public void setStatusHistory(int statusHistory) {
        this.statusHistory = statusHistory;
    }

    public Sensors getSensors() {
        return sensors;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public static class Heartbeat {

        @NotNull
        private Duration ttl = Duration.ofSeconds(5);
        @NotNull
        private Duration interval = Duration.ofSeconds(1);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Loop {

        @NotNull
        private Duration blockTimeout = Duration.ofSeconds(1);
        @Min(1)
        private int readCount = 16;
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

        public int getReadCount() {
            return readCount;
        }

        public void setReadCount(int readCount) {
            this.readCount = readCount;
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

    public static class Sensors {

        private List<String> ids = new ArrayList<>(List.of("imu", "therm", "peltier", "lidar"));
        /**
         * Cadence of idle-time sampling; zero disables it.
         */
        @NotNull
        private Duration sampleInterval = Duration.ofSeconds(10);

        public List<String> getIds() {
            return ids;
        }

        public void setIds(List<String> ids) {
            this.ids = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
        }

        public Duration getSampleInterval() {
            return sampleInterval;
        }

        public void setSampleInterval(Duration sampleInterval) {
            this.sampleInterval = sampleInterval;
        }
    }

    public static class Simulation {

        private boolean enabled = true;
        @NotNull
        private Duration latency = Duration.ofMillis(50);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getLatency() {
            return latency;
        }

        public void setLatency(Duration latency) {
            this.latency = latency;
        }
    }
}
