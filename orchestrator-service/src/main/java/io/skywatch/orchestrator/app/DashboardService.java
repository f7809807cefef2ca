package io.skywatch.orchestrator.app;

import io.skywatch.bus.StreamBus;
import io.skywatch.bus.StreamEntry;
import io.skywatch.orchestrator.domain.OrchestratorSnapshot;
import io.skywatch.orchestrator.domain.OutstandingCommand;
import io.skywatch.protocol.DataRecord;
import io.skywatch.protocol.MalformedEntryException;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.protocol.StatusRecord;
import io.skywatch.protocol.StreamNames;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the read-only dashboard payloads. Every payload starts with a {@code timestamp}; a bus
 * that cannot be reached surfaces as {@link io.skywatch.bus.BusUnavailableException}.
 */
public class DashboardService {

    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

    private final StreamBus bus;
    private final ProtocolCodec codec;
    private final ObservationOrchestrator orchestrator;
    private final LivenessMonitor liveness;
    private final String target;
    private final List<String> sensors;
    private final Clock clock;

    public DashboardService(StreamBus bus,
                            ProtocolCodec codec,
                            ObservationOrchestrator orchestrator,
                            LivenessMonitor liveness,
                            String target,
                            List<String> sensors,
                            Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.liveness = Objects.requireNonNull(liveness, "liveness");
        this.target = Objects.requireNonNull(target, "target");
        this.sensors = List.copyOf(sensors);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Map<String, Object> status() {
        bus.ping().orElseThrow();
        OrchestratorSnapshot snapshot = orchestrator.snapshot();
        Map<String, Object> body = payload();
        body.put("target", snapshot.target());
        body.put("state", snapshot.state().wireName());
        body.put("executor_connected", liveness.isConnected());
        Map<String, Object> cursor = new LinkedHashMap<>();
        cursor.put("cycle", snapshot.cycle());
        cursor.put("index", snapshot.index());
        cursor.put("step", snapshot.currentStep());
        cursor.put("duration_s", snapshot.currentDuration().toSeconds());
        body.put("cursor", cursor);
        body.put("next_sequence", snapshot.nextSequence());
        body.put("outstanding", describe(snapshot.outstanding()));
        body.put("last_status", describe(snapshot.lastStatus()));
        body.put("pause_requested", snapshot.pauseRequested());
        body.put("dwell_until", snapshot.dwellUntil() == null ? null : snapshot.dwellUntil().toString());
        body.put("schedule", snapshot.scheduleFingerprint());
        body.put("cycle_length_s", snapshot.cycleLength().toSeconds());
        body.put("last_bus_error", snapshot.lastBusError());
        body.put("updated_at", snapshot.updatedAt().toString());
        return body;
    }

    public Map<String, Object> health() {
        bus.ping().orElseThrow();
        boolean alive = bus.isAlive(StreamNames.heartbeat(target)).orElseThrow();
        Map<String, Object> components = new LinkedHashMap<>();
        components.put("bus", Map.of("status", "up"));
        Map<String, Object> executor = new LinkedHashMap<>();
        executor.put("status", alive ? "up" : "down");
        executor.put("connected", liveness.isConnected());
        executor.put("missed_polls", liveness.missedPolls());
        executor.put("last_alive", liveness.lastAlive() == null ? null : liveness.lastAlive().toString());
        executor.put("capabilities", bus.getValue(StreamNames.capabilities(target)).orElseThrow()
            .map(this::parseOrRaw).orElse(null));
        components.put("executor", executor);
        components.put("orchestrator", Map.of("status", orchestrator.state().wireName()));
        Map<String, Object> body = payload();
        body.put("status", alive ? "up" : "degraded");
        body.put("components", components);
        return body;
    }

    public Map<String, Object> sensors() {
        Map<String, Object> readings = new LinkedHashMap<>();
        for (String sensor : sensors) {
            List<StreamEntry> latest = bus.readLatest(StreamNames.data(sensor), 1).orElseThrow();
            readings.put(sensor, latest.isEmpty() ? null : describe(latest.get(0)));
        }
        Map<String, Object> body = payload();
        body.put("sensors", readings);
        return body;
    }

    public Map<String, Object> correlator() {
        Optional<String> config = bus.getValue(StreamNames.CORRELATOR_CONFIG).orElseThrow();
        Map<String, Object> body = payload();
        body.put("configured", config.isPresent());
        body.put("config", config.map(this::parseOrRaw).orElse(null));
        return body;
    }

    private Map<String, Object> payload() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        return body;
    }

    private Map<String, Object> describe(StreamEntry entry) {
        try {
            DataRecord record = codec.decodeData(entry);
            Map<String, Object> reading = new LinkedHashMap<>(record.values());
            reading.put("recorded_at", record.recordedAt().toString());
            return reading;
        } catch (MalformedEntryException ex) {
            log.debug("Unreadable data entry {}: {}", entry.id(), ex.getMessage());
            return Map.of("error", "malformed entry " + entry.id());
        }
    }

    private static Map<String, Object> describe(OutstandingCommand command) {
        if (command == null) {
            return null;
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sequence", command.sequence());
        view.put("op", command.op());
        view.put("state", command.scheduleState());
        view.put("deliveries", command.deliveries());
        view.put("error_attempts", command.errorAttempts());
        view.put("published_at", command.publishedAt() == null ? null : command.publishedAt().toString());
        return view;
    }

    private static Map<String, Object> describe(StatusRecord status) {
        if (status == null) {
            return null;
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sequence", status.sequence());
        view.put("result", status.result().wireName());
        view.put("detail", status.detail());
        view.put("emitted_at", status.emittedAt().toString());
        return view;
    }

    private Object parseOrRaw(String json) {
        try {
            return codec.fromJson(json);
        } catch (MalformedEntryException ex) {
            log.debug("Stored value is not a JSON object: {}", ex.getMessage());
            return json;
        }
    }
}
