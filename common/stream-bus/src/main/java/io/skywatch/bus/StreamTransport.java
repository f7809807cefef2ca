package io.skywatch.bus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw access to the stream store. Implementations may throw any runtime exception; only
 * {@link StreamBus} is allowed to call them.
 */
public interface StreamTransport extends AutoCloseable {

    void connect();

    EntryId append(String stream, Map<String, String> fields, long maxLength);

    List<StreamEntry> readAfter(String stream, EntryId after, int count, Duration block);

    List<StreamEntry> readLatest(String stream, int count);

    void setWithTtl(String key, String value, Duration ttl);

    void set(String key, String value);

    Optional<String> get(String key);

    void ping();

    /**
     * Maps a transport exception to a bus cause code.
     */
    default BusErrorCause classify(RuntimeException failure) {
        return BusErrorCause.INTERNAL;
    }

    @Override
    void close();
}
