package io.skywatch.executor.hardware;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface Correlator {

    /**
     * Applies the given parameters. A successful outcome's detail is the configuration now in effect.
     */
    CompletableFuture<HardwareOutcome> configureCorrelator(Map<String, Object> params);
}
