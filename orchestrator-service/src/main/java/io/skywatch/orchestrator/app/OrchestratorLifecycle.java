package io.skywatch.orchestrator.app;

import java.util.Objects;
import org.springframework.context.SmartLifecycle;

/**
 * Starts liveness polling, then the state machine. Stops them in reverse order.
 */
public final class OrchestratorLifecycle implements SmartLifecycle {

    private final ObservationOrchestrator orchestrator;
    private final LivenessMonitor liveness;
    private volatile boolean running;

    public OrchestratorLifecycle(ObservationOrchestrator orchestrator, LivenessMonitor liveness) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.liveness = Objects.requireNonNull(liveness, "liveness");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        liveness.start();
        orchestrator.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        orchestrator.stop();
        liveness.stop();
        running = false;
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
