package io.skywatch.orchestrator.app;

import io.skywatch.bus.BusResult;
import io.skywatch.bus.StreamBus;
import io.skywatch.protocol.StreamNames;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the executor heartbeat on its own timer. The executor counts as disconnected after
 * {@code missedThreshold} consecutive misses; a single alive poll reconnects it. Bus errors count
 * as misses.
 */
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final StreamBus bus;
    private final String key;
    private final Duration pollInterval;
    private final int missedThreshold;
    private final Clock clock;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicInteger missed = new AtomicInteger();
    private final AtomicLong alivePolls = new AtomicLong();
    private final AtomicReference<Instant> lastAlive = new AtomicReference<>();
    private volatile ScheduledExecutorService scheduler;

    public LivenessMonitor(StreamBus bus, String target, Duration pollInterval, int missedThreshold, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.key = StreamNames.heartbeat(target);
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("liveness poll interval must be > 0");
        }
        if (missedThreshold < 1) {
            throw new IllegalArgumentException("missedThreshold must be >= 1");
        }
        this.missedThreshold = missedThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "liveness-" + key);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::safePoll, pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Liveness monitor polling {} every {}ms (threshold {})", key, pollInterval.toMillis(), missedThreshold);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    /**
     * Polls the heartbeat once.
     *
     * @return whether the executor is considered connected afterwards
     */
    public boolean poll() {
        BusResult<Boolean> alive = bus.isAlive(key);
        if (alive.isOk() && Boolean.TRUE.equals(alive.value())) {
            missed.set(0);
            alivePolls.incrementAndGet();
            lastAlive.set(clock.instant());
            if (connected.compareAndSet(false, true)) {
                log.info("Executor heartbeat {} alive; connected", key);
            }
            return true;
        }
        int misses = missed.incrementAndGet();
        if (!alive.isOk()) {
            log.warn("Heartbeat poll on {} failed ({} missed): {}", key, misses, alive.error().describe());
        } else {
            log.debug("Heartbeat {} absent ({} missed)", key, misses);
        }
        if (misses >= missedThreshold && connected.compareAndSet(true, false)) {
            log.warn("Executor heartbeat {} missing for {} polls; disconnected", key, misses);
        }
        return connected.get();
    }

    public boolean isConnected() {
        return connected.get();
    }

    public int missedPolls() {
        return missed.get();
    }

    /**
     * Number of alive polls so far. Lets callers tell a fresh sighting from a stale one.
     */
    public long alivePolls() {
        return alivePolls.get();
    }

    public Instant lastAlive() {
        return lastAlive.get();
    }

    public String key() {
        return key;
    }

    private void safePoll() {
        try {
            poll();
        } catch (RuntimeException ex) {
            log.warn("Liveness poll failed", ex);
        }
    }
}
