package io.skywatch.executor.hardware;

import java.util.concurrent.CompletableFuture;

public interface NetworkAnalyzer {

    /**
     * Runs an OSL-calibrated S11 scan. A successful outcome carries the measured traces in its detail.
     */
    CompletableFuture<HardwareOutcome> runVnaScan(VnaSettings settings);
}
