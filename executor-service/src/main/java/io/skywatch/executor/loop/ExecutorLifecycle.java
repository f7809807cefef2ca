package io.skywatch.executor.loop;

import io.skywatch.protocol.StreamNames;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the executor once the context is ready: advertises capabilities, starts the heartbeat,
 * then the command loop. Stops in reverse order.
 */
public final class ExecutorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutorLifecycle.class);

    private final String target;
    private final CommandExecutor executor;
    private final HeartbeatEmitter heartbeat;
    private final CommandDispatcher dispatcher;
    private final DataPublisher dataPublisher;
    private final Clock clock;
    private volatile boolean running;

    public ExecutorLifecycle(String target,
                             CommandExecutor executor,
                             HeartbeatEmitter heartbeat,
                             CommandDispatcher dispatcher,
                             DataPublisher dataPublisher,
                             Clock clock) {
        this.target = Objects.requireNonNull(target, "target");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.dataPublisher = Objects.requireNonNull(dataPublisher, "dataPublisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        advertiseCapabilities();
        heartbeat.start();
        executor.start();
        running = true;
        log.info("Executor for target {} running", target);
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        executor.stop();
        heartbeat.stop();
        running = false;
        log.info("Executor for target {} stopped", target);
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

    private void advertiseCapabilities() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("target", target);
        capabilities.put("ops", dispatcher.supportedOps());
        capabilities.put("sensors", dispatcher.sensorIds());
        capabilities.put("started_at", clock.instant().toString());
        if (dataPublisher.putJson(StreamNames.capabilities(target), capabilities)) {
            log.info("Advertised capabilities for {}: ops={} sensors={}",
                target, capabilities.get("ops"), capabilities.get("sensors"));
        }
    }
}
