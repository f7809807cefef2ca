package io.skywatch.executor.loop;

import io.skywatch.bus.BusResult;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.StreamBus;
import io.skywatch.protocol.DataRecord;
import io.skywatch.protocol.ProtocolCodec;
import io.skywatch.protocol.StreamNames;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes measurements to {@code data:*} streams and plain configuration keys. Failures are
 * logged and reported to the caller; measurements are not queued for later.
 */
public class DataPublisher {

    private static final Logger log = LoggerFactory.getLogger(DataPublisher.class);

    private final StreamBus bus;
    private final ProtocolCodec codec;

    public DataPublisher(StreamBus bus, ProtocolCodec codec) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public boolean publish(DataRecord record) {
        String stream = StreamNames.data(record.source());
        BusResult<EntryId> result = bus.publish(stream, codec.encodeData(record));
        if (!result.isOk()) {
            log.warn("[DATA] SEND failed stream={} cause={}", stream, result.error().describe());
            return false;
        }
        log.debug("[DATA] SEND stream={} id={}", stream, result.value());
        return true;
    }

    public boolean putJson(String key, Map<String, Object> value) {
        BusResult<Void> result = bus.putValue(key, codec.toJson(value));
        if (!result.isOk()) {
            log.warn("Failed to store {}: {}", key, result.error().describe());
            return false;
        }
        return true;
    }
}
