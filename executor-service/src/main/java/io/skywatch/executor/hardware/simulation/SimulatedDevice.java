package io.skywatch.executor.hardware.simulation;

import io.skywatch.executor.hardware.HardwareFaultException;
import io.skywatch.executor.hardware.HardwareKind;
import io.skywatch.executor.hardware.HardwareOutcome;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Common behaviour of the simulated drivers: latency, scripted faults, a device that stops
 * answering, and a call counter.
 */
abstract class SimulatedDevice {

    private final HardwareKind kind;
    private final Duration latency;
    private final Deque<String> scriptedFaults = new ArrayDeque<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile String persistentFault;
    private volatile boolean unresponsive;

    SimulatedDevice(HardwareKind kind, Duration latency) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
    }

    /**
     * Makes the next call fail with {@code cause}.
     */
    public synchronized void failNext(String cause) {
        scriptedFaults.addLast(Objects.requireNonNull(cause, "cause"));
    }

    /**
     * Makes every call fail with {@code cause} until cleared with {@code null}.
     */
    public void failAlways(String cause) {
        this.persistentFault = cause;
    }

    /**
     * While set, calls return futures that never complete.
     */
    public void setUnresponsive(boolean unresponsive) {
        this.unresponsive = unresponsive;
    }

    public int invocations() {
        return invocations.get();
    }

    protected final HardwareKind kind() {
        return kind;
    }

    protected final CompletableFuture<HardwareOutcome> invoke(Supplier<HardwareOutcome> action) {
        invocations.incrementAndGet();
        if (unresponsive) {
            return new CompletableFuture<>();
        }
        String fault = nextFault();
        Supplier<HardwareOutcome> effective = fault == null
            ? action
            : () -> {
                throw new HardwareFaultException(kind, fault);
            };
        if (latency.isZero()) {
            return CompletableFuture.supplyAsync(effective);
        }
        return CompletableFuture.supplyAsync(effective,
            CompletableFuture.delayedExecutor(latency.toMillis(), TimeUnit.MILLISECONDS));
    }

    private synchronized String nextFault() {
        String scripted = scriptedFaults.pollFirst();
        return scripted != null ? scripted : persistentFault;
    }
}
