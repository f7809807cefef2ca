package io.skywatch.executor.hardware.simulation;

import io.skywatch.executor.hardware.Correlator;
import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps the merged parameter set; every call layers the new parameters over the previous ones.
 */
public final class SimulatedCorrelator extends SimulatedDevice implements Correlator {

    private final Map<String, Object> config = new LinkedHashMap<>();

    public SimulatedCorrelator(Duration latency) {
        super(HardwareKind.CORRELATOR, latency);
    }

    @Override
    public CompletableFuture<HardwareOutcome> configureCorrelator(Map<String, Object> params) {
        Map<String, Object> requested = params == null ? Map.of() : new LinkedHashMap<>(params);
        return invoke(() -> {
            synchronized (config) {
                config.putAll(requested);
                return HardwareOutcome.success(kind(), new LinkedHashMap<>(config));
            }
        });
    }
}
