package io.skywatch.executor.hardware;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface SensorArray {

    /**
     * Identifiers of the sensors that answered during initialisation.
     */
    List<String> sensorIds();

    CompletableFuture<HardwareOutcome> readSensor(String id);
}
