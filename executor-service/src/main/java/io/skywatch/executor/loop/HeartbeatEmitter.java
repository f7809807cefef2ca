package io.skywatch.executor.loop;

import io.skywatch.bus.BusResult;
import io.skywatch.bus.StreamBus;
import io.skywatch.protocol.StreamNames;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes {@code heartbeat:{target}} on its own timer thread, independent of command traffic.
 * An orderly stop writes the dead marker so the orchestrator does not wait out the TTL.
 */
public class HeartbeatEmitter {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatEmitter.class);

    private final StreamBus bus;
    private final String key;
    private final Duration ttl;
    private final Duration interval;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile ScheduledExecutorService scheduler;

    public HeartbeatEmitter(StreamBus bus, String target, Duration ttl, Duration interval) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.key = StreamNames.heartbeat(target);
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be > 0");
        }
        if (ttl.compareTo(interval) <= 0) {
            throw new IllegalArgumentException("heartbeat ttl (" + ttl + ") must exceed the refresh interval (" + interval + ")");
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "heartbeat-" + key);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::safeBeat, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Heartbeat started on {} (ttl={}ms, interval={}ms)", key, ttl.toMillis(), interval.toMillis());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        bus.markDead(key).onFailure(error -> log.warn("Could not mark {} dead: {}", key, error.describe()));
        log.info("Heartbeat stopped on {}", key);
    }

    /**
     * Sends one refresh.
     *
     * @return whether the bus accepted it
     */
    public boolean beat() {
        BusResult<Void> result = bus.refreshHeartbeat(key, ttl);
        if (result.isOk()) {
            int missed = consecutiveFailures.getAndSet(0);
            if (missed > 0) {
                log.info("Heartbeat on {} recovered after {} failed refreshes", key, missed);
            }
            return true;
        }
        int failures = consecutiveFailures.incrementAndGet();
        if (failures == 1 || failures % 10 == 0) {
            log.warn("Heartbeat refresh on {} failed ({} in a row): {}", key, failures, result.error().describe());
        }
        return false;
    }

    private void safeBeat() {
        try {
            beat();
        } catch (RuntimeException ex) {
            log.warn("Heartbeat tick failed", ex);
        }
    }
}
