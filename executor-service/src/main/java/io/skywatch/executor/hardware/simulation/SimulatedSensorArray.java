package io.skywatch.executor.hardware.simulation;

import io.skywatch.executor.hardware.HardwareFaultException;
import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import io.skywatch.executor.hardware.SensorArray;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

public final class SimulatedSensorArray extends SimulatedDevice implements SensorArray {

    private final List<String> sensorIds;
    private final AtomicLong samples = new AtomicLong();

    public SimulatedSensorArray(List<String> sensorIds, Duration latency) {
        super(HardwareKind.SENSOR, latency);
        this.sensorIds = List.copyOf(sensorIds);
    }

    @Override
    public List<String> sensorIds() {
        return sensorIds;
    }

    @Override
    public CompletableFuture<HardwareOutcome> readSensor(String id) {
        return invoke(() -> {
            if (!sensorIds.contains(id)) {
                throw new HardwareFaultException(kind(), "unknown sensor " + id);
            }
            long n = samples.incrementAndGet();
            Map<String, Object> reading = new LinkedHashMap<>();
            reading.put("sensor", id);
            switch (id) {
                case "imu" -> {
                    reading.put("pitch_deg", 0.1 * Math.sin(n / 10.0));
                    reading.put("roll_deg", 0.1 * Math.cos(n / 10.0));
                }
                case "lidar" -> reading.put("distance_m", 12.5 + 0.01 * (n % 7));
                case "peltier" -> {
                    reading.put("target_c", 30.0);
                    reading.put("temp_c", 30.0 + 0.2 * Math.sin(n / 5.0));
                }
                default -> reading.put("temp_c", 25.0 + 0.5 * Math.sin(n / 20.0));
            }
            return HardwareOutcome.success(kind(), reading);
        });
    }
}
