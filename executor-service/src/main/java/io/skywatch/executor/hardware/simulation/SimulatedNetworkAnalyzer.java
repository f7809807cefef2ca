package io.skywatch.executor.hardware.simulation;

import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import io.skywatch.executor.hardware.NetworkAnalyzer;
import io.skywatch.executor.hardware.VnaSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Produces a smooth synthetic S11 trace; the receiver is a few dB better matched than the antenna.
 */
public final class SimulatedNetworkAnalyzer extends SimulatedDevice implements NetworkAnalyzer {

    public SimulatedNetworkAnalyzer(Duration latency) {
        super(HardwareKind.VNA, latency);
    }

    @Override
    public CompletableFuture<HardwareOutcome> runVnaScan(VnaSettings settings) {
        return invoke(() -> {
            double offset = "ant".equals(settings.mode()) ? -8.0 : -14.0;
            List<Double> s11 = new ArrayList<>(settings.points());
            for (int i = 0; i < settings.points(); i++) {
                double phase = (double) i / (settings.points() - 1);
                s11.add(offset - 3.0 * Math.sin(Math.PI * phase));
            }
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("mode", settings.mode());
            detail.put("power_dbm", settings.powerDbm());
            detail.put("fstart_hz", settings.startHz());
            detail.put("fstop_hz", settings.stopHz());
            detail.put("npoints", settings.points());
            detail.put("s11_db", s11);
            return HardwareOutcome.success(kind(), detail);
        });
    }
}
