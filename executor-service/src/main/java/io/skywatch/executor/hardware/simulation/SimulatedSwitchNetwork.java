package io.skywatch.executor.hardware.simulation;

import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import io.skywatch.executor.hardware.SwitchNetwork;
import io.skywatch.executor.hardware.SwitchPath;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public final class SimulatedSwitchNetwork extends SimulatedDevice implements SwitchNetwork {

    private volatile SwitchPath current;

    public SimulatedSwitchNetwork(Duration latency) {
        super(HardwareKind.SWITCH, latency);
    }

    @Override
    public CompletableFuture<HardwareOutcome> applySwitchState(SwitchPath path) {
        return invoke(() -> {
            current = path;
            return HardwareOutcome.success(kind(), Map.of("sw_state", path.name()));
        });
    }

    public SwitchPath current() {
        return current;
    }
}
