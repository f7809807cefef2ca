package io.skywatch.executor.loop;

import io.skywatch.executor.hardware.Correlator;
import io.skywatch.executor.hardware.HardwareFaultException;
import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import io.skywatch.executor.hardware.NetworkAnalyzer;
import io.skywatch.executor.hardware.SensorArray;
import io.skywatch.executor.hardware.SwitchNetwork;
import io.skywatch.executor.hardware.SwitchPath;
import io.skywatch.executor.hardware.VnaSettings;
import io.skywatch.protocol.Command;
import io.skywatch.protocol.CommandOp;
import io.skywatch.protocol.DataRecord;
import io.skywatch.protocol.StatusRecord;
import io.skywatch.protocol.StreamNames;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command against the matching hardware capability and turns the outcome into a
 * {@link StatusRecord}. Never throws for hardware problems: faults, timeouts and bad arguments all
 * become {@code error} statuses whose detail carries {@code cause} and {@code kind}.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String KIND = "kind";
    private static final List<String> DEFAULT_VNA_MODES = List.of("ant", "rec");

    private final SwitchNetwork switchNetwork;
    private final NetworkAnalyzer networkAnalyzer;
    private final SensorArray sensorArray;
    private final Correlator correlator;
    private final DataPublisher dataPublisher;
    private final Duration hardwareTimeout;
    private final Clock clock;
    private volatile SwitchPath lastPath;

    public CommandDispatcher(SwitchNetwork switchNetwork,
                             NetworkAnalyzer networkAnalyzer,
                             SensorArray sensorArray,
                             Correlator correlator,
                             DataPublisher dataPublisher,
                             Duration hardwareTimeout,
                             Clock clock) {
        this.switchNetwork = Objects.requireNonNull(switchNetwork, "switchNetwork");
        this.networkAnalyzer = Objects.requireNonNull(networkAnalyzer, "networkAnalyzer");
        this.sensorArray = Objects.requireNonNull(sensorArray, "sensorArray");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.dataPublisher = Objects.requireNonNull(dataPublisher, "dataPublisher");
        this.hardwareTimeout = Objects.requireNonNull(hardwareTimeout, "hardwareTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<String> supportedOps() {
        List<String> ops = new ArrayList<>();
        for (CommandOp op : CommandOp.values()) {
            ops.add(op.wireName());
        }
        return ops;
    }

    public StatusRecord dispatch(Command command) {
        Objects.requireNonNull(command, "command");
        Optional<CommandOp> op = CommandOp.fromWire(command.op());
        if (op.isEmpty()) {
            log.warn("Rejecting command {} with unsupported op '{}'", command.sequence(), command.op());
            return StatusRecord.error(command.sequence(), "unsupported op '" + command.op() + "'",
                Map.of("op", command.op()), clock.instant());
        }
        HardwareKind kind = HardwareKind.forOp(op.get());
        try {
            Map<String, Object> detail = switch (op.get()) {
                case SWITCH -> applySwitch(command.args());
                case VNA -> runVna(command.args());
                case SENSOR -> readSensor(command.args());
                case CORRELATOR -> configureCorrelator(command.args());
            };
            Map<String, Object> withKind = new LinkedHashMap<>();
            withKind.put(KIND, kind.wireName());
            withKind.putAll(detail);
            return StatusRecord.ok(command.sequence(), withKind, clock.instant());
        } catch (HardwareFaultException ex) {
            log.warn("Command {} ({}) failed: {}", command.sequence(), kind.wireName(), ex.getMessage());
            return StatusRecord.error(command.sequence(), ex.getMessage(), Map.of(KIND, ex.kind().wireName()), clock.instant());
        } catch (IllegalArgumentException ex) {
            log.warn("Command {} ({}) has invalid args: {}", command.sequence(), kind.wireName(), ex.getMessage());
            return StatusRecord.error(command.sequence(), "invalid args: " + ex.getMessage(),
                Map.of(KIND, kind.wireName()), clock.instant());
        } catch (RuntimeException ex) {
            log.warn("Command {} ({}) driver failed", command.sequence(), kind.wireName(), ex);
            return StatusRecord.error(command.sequence(), kind.wireName() + " fault: " + ex.getMessage(),
                Map.of(KIND, kind.wireName()), clock.instant());
        }
    }

    /**
     * Reads one sensor and publishes the reading to {@code data:{id}}.
     *
     * @return whether the reading was published
     */
    public boolean sampleSensor(String id) {
        try {
            HardwareOutcome outcome = await(HardwareKind.SENSOR, sensorArray.readSensor(id));
            return dataPublisher.publish(new DataRecord(id, outcome.detail(), clock.instant()));
        } catch (HardwareFaultException ex) {
            log.warn("Sampling sensor {} failed: {}", id, ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            log.warn("Sampling sensor {} failed", id, ex);
            return false;
        }
    }

    public List<String> sensorIds() {
        return sensorArray.sensorIds();
    }

    private Map<String, Object> applySwitch(Map<String, Object> args) {
        SwitchPath path = SwitchPath.parse(text(args, "path"));
        HardwareOutcome outcome = await(HardwareKind.SWITCH, switchNetwork.applySwitchState(path));
        lastPath = path;
        Map<String, Object> detail = new LinkedHashMap<>(outcome.detail());
        detail.put("path", path.name());
        return detail;
    }

    private Map<String, Object> runVna(Map<String, Object> args) {
        List<String> modes = modes(args.get("modes"));
        List<VnaSettings> scans = new ArrayList<>();
        for (String mode : modes) {
            scans.add(VnaSettings.fromArgs(mode, args));
        }
        boolean published = true;
        for (VnaSettings settings : scans) {
            HardwareOutcome outcome = await(HardwareKind.VNA, networkAnalyzer.runVnaScan(settings));
            published &= dataPublisher.publish(new DataRecord("vna", outcome.detail(), clock.instant()));
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("modes", modes);
        detail.put("npoints", scans.get(0).points());
        detail.put("data_published", published);
        SwitchPath previous = lastPath;
        if (previous != null) {
            await(HardwareKind.SWITCH, switchNetwork.applySwitchState(previous));
            detail.put("restored_path", previous.name());
        }
        return detail;
    }

    private Map<String, Object> readSensor(Map<String, Object> args) {
        String id = text(args, "sensor");
        HardwareOutcome outcome = await(HardwareKind.SENSOR, sensorArray.readSensor(id));
        boolean published = dataPublisher.publish(new DataRecord(id, outcome.detail(), clock.instant()));
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("sensor", id);
        detail.put("reading", outcome.detail());
        detail.put("data_published", published);
        return detail;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> configureCorrelator(Map<String, Object> args) {
        Object raw = args.get("params");
        if (raw != null && !(raw instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("correlator params must be a mapping");
        }
        Map<String, Object> params = raw == null ? new LinkedHashMap<>() : new LinkedHashMap<>((Map<String, Object>) raw);
        Object integration = args.get("integration_seconds");
        if (integration != null) {
            params.put("integration_seconds", integration);
        }
        HardwareOutcome outcome = await(HardwareKind.CORRELATOR, correlator.configureCorrelator(params));
        Map<String, Object> config = new LinkedHashMap<>(outcome.detail());
        config.put("configured_at", clock.instant().toString());
        boolean stored = dataPublisher.putJson(StreamNames.CORRELATOR_CONFIG, config);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("config", outcome.detail());
        detail.put("config_published", stored);
        return detail;
    }

    private HardwareOutcome await(HardwareKind kind, CompletableFuture<HardwareOutcome> call) {
        if (call == null) {
            throw new HardwareFaultException(kind, kind.wireName() + " fault: driver returned no result");
        }
        HardwareOutcome outcome;
        try {
            outcome = call.get(hardwareTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (CancellationException ex) {
            throw new HardwareFaultException(kind, kind.wireName() + " cancelled", ex);
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new HardwareFaultException(kind, kind.wireName() + " timeout", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof HardwareFaultException fault) {
                throw fault;
            }
            String message = cause == null ? ex.getMessage() : cause.getMessage();
            throw new HardwareFaultException(kind, kind.wireName() + " fault: " + message, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HardwareFaultException(kind, kind.wireName() + " interrupted", ex);
        }
        if (outcome == null) {
            throw new HardwareFaultException(kind, kind.wireName() + " returned no outcome");
        }
        if (!outcome.success()) {
            throw new HardwareFaultException(kind, outcome.cause());
        }
        return outcome;
    }

    private static List<String> modes(Object raw) {
        if (raw == null) {
            return DEFAULT_VNA_MODES;
        }
        if (raw instanceof List<?> list && !list.isEmpty()) {
            List<String> modes = new ArrayList<>(list.size());
            for (Object mode : list) {
                modes.add(String.valueOf(mode));
            }
            return modes;
        }
        if (raw instanceof String text && !text.isBlank()) {
            return List.of(text.trim());
        }
        throw new IllegalArgumentException("VNA modes must be a non-empty list");
    }

    private static String text(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("missing '" + name + "'");
        }
        return value.toString().trim();
    }
}
