package io.skywatch.bus.transport;

import io.skywatch.bus.BusErrorCause;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.StreamEntry;
import io.skywatch.bus.StreamTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local stream store with the same ordering and expiry rules as Redis.
 * <p>
 * Key expiry follows the supplied {@link Clock}; blocking reads wait in real time. An outage can
 * be simulated with {@link #setAvailable(boolean)}.
 */
public final class InMemoryStreamTransport implements StreamTransport {

    private final Clock clock;
    private final Map<String, List<StreamEntry>> streams = new HashMap<>();
    private final Map<String, StoredValue> values = new HashMap<>();
    private final Map<String, EntryId> lastIds = new HashMap<>();
    private boolean available = true;
    private boolean connected;

    public InMemoryStreamTransport() {
        this(Clock.systemUTC());
    }

    public InMemoryStreamTransport(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void setAvailable(boolean available) {
        this.available = available;
        notifyAll();
    }

    public synchronized int size(String stream) {
        List<StreamEntry> entries = streams.get(stream);
        return entries == null ? 0 : entries.size();
    }

    @Override
    public synchronized void connect() {
        ensureAvailable();
        connected = true;
    }

    @Override
    public synchronized EntryId append(String stream, Map<String, String> fields, long maxLength) {
        ensureReady();
        EntryId id = nextId(stream);
        List<StreamEntry> entries = streams.computeIfAbsent(stream, s -> new ArrayList<>());
        entries.add(new StreamEntry(stream, id, fields));
        if (maxLength > 0 && entries.size() > maxLength) {
            entries.subList(0, (int) (entries.size() - maxLength)).clear();
        }
        notifyAll();
        return id;
    }

    @Override
    public synchronized List<StreamEntry> readAfter(String stream, EntryId after, int count, Duration block) {
        ensureReady();
        List<StreamEntry> found = collectAfter(stream, after, count);
        if (!found.isEmpty() || block.isZero()) {
            return found;
        }
        long deadline = System.nanoTime() + block.toNanos();
        while (found.isEmpty()) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                break;
            }
            try {
                wait(remainingMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting on stream " + stream, ex);
            }
            ensureReady();
            found = collectAfter(stream, after, count);
        }
        return found;
    }

    @Override
    public synchronized List<StreamEntry> readLatest(String stream, int count) {
        ensureReady();
        List<StreamEntry> entries = streams.getOrDefault(stream, List.of());
        List<StreamEntry> latest = new ArrayList<>(Math.min(count, entries.size()));
        for (int i = entries.size() - 1; i >= 0 && latest.size() < count; i--) {
            latest.add(entries.get(i));
        }
        return latest;
    }

    @Override
    public synchronized void setWithTtl(String key, String value, Duration ttl) {
        ensureReady();
        values.put(key, new StoredValue(value, clock.instant().plus(ttl)));
    }

    @Override
    public synchronized void set(String key, String value) {
        ensureReady();
        values.put(key, new StoredValue(value, null));
    }

    @Override
    public synchronized Optional<String> get(String key) {
        ensureReady();
        StoredValue stored = values.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.expiresAt() != null && !clock.instant().isBefore(stored.expiresAt())) {
            values.remove(key);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public synchronized void ping() {
        ensureReady();
    }

    @Override
    public BusErrorCause classify(RuntimeException failure) {
        if (failure instanceof OutageException || failure instanceof IllegalStateException) {
            return BusErrorCause.UNAVAILABLE;
        }
        return BusErrorCause.INTERNAL;
    }

    @Override
    public synchronized void close() {
        connected = false;
        notifyAll();
    }

    private List<StreamEntry> collectAfter(String stream, EntryId after, int count) {
        List<StreamEntry> entries = streams.getOrDefault(stream, List.of());
        List<StreamEntry> found = new ArrayList<>();
        for (StreamEntry entry : entries) {
            if (entry.id().isAfter(after)) {
                found.add(entry);
                if (found.size() == count) {
                    break;
                }
            }
        }
        return found;
    }

    private EntryId nextId(String stream) {
        long now = clock.millis();
        EntryId last = lastIds.get(stream);
        EntryId next;
        if (last == null || now > last.millis()) {
            next = new EntryId(now, 0L);
        } else {
            next = new EntryId(last.millis(), last.sequence() + 1);
        }
        lastIds.put(stream, next);
        return next;
    }

    private void ensureReady() {
        ensureAvailable();
        if (!connected) {
            throw new IllegalStateException("Not connected to in-memory store");
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new OutageException();
        }
    }

    private record StoredValue(String value, Instant expiresAt) {
    }

    static final class OutageException extends RuntimeException {
        OutageException() {
            super("in-memory store unavailable");
        }
    }
}
