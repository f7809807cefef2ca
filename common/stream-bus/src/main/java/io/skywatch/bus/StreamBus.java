package io.skywatch.bus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle to the stream store shared by the orchestrator and the executor.
 * <p>
 * Every public operation returns a {@link BusResult}; transport exceptions are captured and
 * classified here and never escape to callers. There is no other path to the transport.
 */
public final class StreamBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamBus.class);

    static final String ALIVE = "1";
    static final String DEAD = "0";
    private static final int DEFAULT_READ_COUNT = 64;

    private final StreamTransport transport;
    private final BusSettings settings;
    private final Sleeper sleeper;
    private final AtomicBoolean open = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public StreamBus(StreamTransport transport, BusSettings settings) {
        this(transport, settings, Sleeper.SYSTEM);
    }

    public StreamBus(StreamTransport transport, BusSettings settings, Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Connects the underlying transport, retrying like {@link #publish}.
     */
    public BusResult<Void> open() {
        if (closed.get()) {
            return BusResult.failed(new BusError(BusErrorCause.CLOSED, "open", "bus handle is closed", 0));
        }
        BusResult<Void> result = withRetry("open", () -> {
            transport.connect();
            transport.ping();
            return null;
        });
        if (result.isOk()) {
            open.set(true);
            log.info("Stream bus opened");
        }
        return result;
    }

    public boolean isOpen() {
        return open.get() && !closed.get();
    }

    public BusResult<EntryId> publish(String stream, Map<String, String> fields) {
        if (isBlank(stream)) {
            return invalid("publish", "stream must not be blank");
        }
        if (fields == null || fields.isEmpty()) {
            return invalid("publish", "fields must not be empty");
        }
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (isBlank(field.getKey()) || field.getValue() == null) {
                return invalid("publish", "field names must be non-blank and values non-null");
            }
        }
        long maxLength = settings.retention().maxLengthFor(stream);
        Map<String, String> copy = Map.copyOf(fields);
        return withRetry("publish " + stream, () -> transport.append(stream, copy, maxLength));
    }

    public BusResult<List<StreamEntry>> read(String stream, EntryId after, Duration blockTimeout) {
        return read(stream, after, blockTimeout, DEFAULT_READ_COUNT);
    }

    public BusResult<List<StreamEntry>> read(String stream, EntryId after, Duration blockTimeout, int count) {
        if (isBlank(stream)) {
            return invalid("read", "stream must not be blank");
        }
        if (blockTimeout == null || blockTimeout.isNegative()) {
            return invalid("read", "blockTimeout must be >= 0");
        }
        if (count < 1) {
            return invalid("read", "count must be >= 1");
        }
        EntryId cursor = after == null ? EntryId.ZERO : after;
        return once("read " + stream, () -> transport.readAfter(stream, cursor, count, blockTimeout));
    }

    public BusResult<List<StreamEntry>> readLatest(String stream, int count) {
        if (isBlank(stream)) {
            return invalid("readLatest", "stream must not be blank");
        }
        if (count < 1) {
            return invalid("readLatest", "count must be >= 1");
        }
        return once("readLatest " + stream, () -> transport.readLatest(stream, count));
    }

    public BusResult<Void> refreshHeartbeat(String key, Duration ttl) {
        if (isBlank(key)) {
            return invalid("refreshHeartbeat", "key must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return invalid("refreshHeartbeat", "ttl must be > 0");
        }
        return once("refreshHeartbeat " + key, () -> {
            transport.setWithTtl(key, ALIVE, ttl);
            return null;
        });
    }

    public BusResult<Void> markDead(String key) {
        if (isBlank(key)) {
            return invalid("markDead", "key must not be blank");
        }
        return once("markDead " + key, () -> {
            transport.set(key, DEAD);
            return null;
        });
    }

    public BusResult<Boolean> isAlive(String key) {
        if (isBlank(key)) {
            return invalid("isAlive", "key must not be blank");
        }
        return once("isAlive " + key, () -> transport.get(key).map(ALIVE::equals).orElse(false));
    }

    public BusResult<Void> putValue(String key, String value) {
        if (isBlank(key) || value == null) {
            return invalid("putValue", "key must not be blank and value must not be null");
        }
        return withRetry("putValue " + key, () -> {
            transport.set(key, value);
            return null;
        });
    }

    public BusResult<Optional<String>> getValue(String key) {
        if (isBlank(key)) {
            return invalid("getValue", "key must not be blank");
        }
        return once("getValue " + key, () -> transport.get(key));
    }

    public BusResult<Void> ping() {
        return once("ping", () -> {
            transport.ping();
            return null;
        });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        open.set(false);
        try {
            transport.close();
            log.info("Stream bus closed");
        } catch (RuntimeException ex) {
            log.warn("Error closing stream bus transport: {}", ex.getMessage());
        }
    }

    private <T> BusResult<T> once(String operation, Supplier<T> call) {
        return attempt(operation, call, 1);
    }

    private <T> BusResult<T> withRetry(String operation, Supplier<T> call) {
        int attempts = settings.publishAttempts();
        BusResult<T> result = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            result = attempt(operation, call, attempt);
            if (result.isOk() || !result.error().cause().isTransient() || attempt == attempts) {
                return result;
            }
            Duration delay = settings.backoff().delayFor(attempt);
            log.debug("Retrying {} in {}ms (attempt {}/{})", operation, delay.toMillis(), attempt + 1, attempts);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return BusResult.failed(new BusError(BusErrorCause.INTERNAL, operation, "interrupted during backoff", attempt));
            }
        }
        return result;
    }

    private <T> BusResult<T> attempt(String operation, Supplier<T> call, int attempt) {
        if (closed.get()) {
            return BusResult.failed(new BusError(BusErrorCause.CLOSED, operation, "bus handle is closed", attempt));
        }
        try {
            return BusResult.ok(call.get());
        } catch (IllegalArgumentException ex) {
            return BusResult.failed(new BusError(BusErrorCause.INVALID_REQUEST, operation, ex.getMessage(), attempt));
        } catch (RuntimeException ex) {
            BusErrorCause cause = classify(ex);
            BusError error = new BusError(cause, operation, ex.getMessage(), attempt);
            if (log.isDebugEnabled()) {
                log.debug("Bus call failed: {}", error.describe(), ex);
            } else {
                log.warn("Bus call failed: {}", error.describe());
            }
            return BusResult.failed(error);
        }
    }

    private BusErrorCause classify(RuntimeException ex) {
        try {
            BusErrorCause cause = transport.classify(ex);
            return cause == null ? BusErrorCause.INTERNAL : cause;
        } catch (RuntimeException classifyFailure) {
            return BusErrorCause.INTERNAL;
        }
    }

    private static <T> BusResult<T> invalid(String operation, String message) {
        return BusResult.failed(new BusError(BusErrorCause.INVALID_REQUEST, operation, message, 0));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
