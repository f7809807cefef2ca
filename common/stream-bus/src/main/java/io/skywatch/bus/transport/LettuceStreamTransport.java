package io.skywatch.bus.transport;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.skywatch.bus.BusErrorCause;
import io.skywatch.bus.EntryId;
import io.skywatch.bus.StreamEntry;
import io.skywatch.bus.StreamTransport;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis streams transport backed by Lettuce.
 * <p>
 * Blocking {@code XREAD} calls run on their own connection: Lettuce multiplexes commands over a
 * connection, so a blocked read would otherwise delay heartbeat writes issued from the timer.
 */
public final class LettuceStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(LettuceStreamTransport.class);

    private final RedisConnectionSettings settings;
    private volatile RedisClient client;
    private volatile StatefulRedisConnection<String, String> connection;
    private volatile StatefulRedisConnection<String, String> blockingConnection;

    public LettuceStreamTransport(RedisConnectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public synchronized void connect() {
        if (connection != null && connection.isOpen()) {
            return;
        }
        RedisURI.Builder builder = RedisURI.builder()
            .withHost(settings.host())
            .withPort(settings.port())
            .withSsl(settings.ssl())
            .withTimeout(settings.commandTimeout());
        if (settings.username() != null && settings.password() != null) {
            builder.withAuthentication(settings.username(), settings.password().toCharArray());
        } else if (settings.password() != null) {
            builder.withPassword(settings.password().toCharArray());
        }
        RedisClient created = client != null ? client : RedisClient.create(builder.build());
        created.setOptions(ClientOptions.builder()
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build());
        client = created;
        connection = created.connect();
        connection.setTimeout(settings.commandTimeout());
        blockingConnection = created.connect();
        blockingConnection.setTimeout(settings.commandTimeout());
        log.info("Connected to Redis at {}:{}", settings.host(), settings.port());
    }

    @Override
    public EntryId append(String stream, Map<String, String> fields, long maxLength) {
        XAddArgs args = new XAddArgs();
        if (maxLength > 0) {
            args.maxlen(maxLength).approximateTrimming();
        }
        String id = commands().xadd(stream, args, fields);
        return EntryId.parse(id);
    }

    @Override
    public List<StreamEntry> readAfter(String stream, EntryId after, int count, Duration block) {
        StatefulRedisConnection<String, String> blocking = requireConnected(blockingConnection);
        XReadArgs args = XReadArgs.Builder.count(count);
        if (!block.isZero()) {
            args.block(block);
            blocking.setTimeout(settings.commandTimeout().plus(block));
        }
        List<StreamMessage<String, String>> messages =
            blocking.sync().xread(args, XReadArgs.StreamOffset.from(stream, after.toString()));
        return toEntries(messages);
    }

    @Override
    public List<StreamEntry> readLatest(String stream, int count) {
        List<StreamMessage<String, String>> messages =
            commands().xrevrange(stream, Range.unbounded(), Limit.from(count));
        return toEntries(messages);
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        commands().set(key, value, SetArgs.Builder.px(ttl.toMillis()));
    }

    @Override
    public void set(String key, String value) {
        commands().set(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(commands().get(key));
    }

    @Override
    public void ping() {
        commands().ping();
    }

    @Override
    public BusErrorCause classify(RuntimeException failure) {
        if (failure instanceof RedisCommandTimeoutException) {
            return BusErrorCause.TIMEOUT;
        }
        if (failure instanceof RedisConnectionException) {
            return BusErrorCause.UNAVAILABLE;
        }
        if (failure instanceof RedisCommandExecutionException) {
            return BusErrorCause.PROTOCOL;
        }
        if (failure instanceof IllegalStateException && failure.getMessage() != null
            && failure.getMessage().startsWith("Not connected")) {
            return BusErrorCause.UNAVAILABLE;
        }
        if (failure instanceof RedisException) {
            Throwable cause = failure.getCause();
            String message = failure.getMessage() == null ? "" : failure.getMessage();
            if (cause instanceof IOException || message.contains("not connected") || message.contains("Connection")) {
                return BusErrorCause.UNAVAILABLE;
            }
            return BusErrorCause.PROTOCOL;
        }
        return BusErrorCause.INTERNAL;
    }

    @Override
    public synchronized void close() {
        closeQuietly(blockingConnection);
        closeQuietly(connection);
        blockingConnection = null;
        connection = null;
        if (client != null) {
            client.shutdown();
            client = null;
        }
    }

    private RedisCommands<String, String> commands() {
        return requireConnected(connection).sync();
    }

    private static StatefulRedisConnection<String, String> requireConnected(
        StatefulRedisConnection<String, String> candidate) {
        if (candidate == null) {
            throw new IllegalStateException("Not connected to Redis");
        }
        return candidate;
    }

    private static List<StreamEntry> toEntries(List<StreamMessage<String, String>> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<StreamEntry> entries = new ArrayList<>(messages.size());
        for (StreamMessage<String, String> message : messages) {
            entries.add(new StreamEntry(message.getStream(), EntryId.parse(message.getId()), message.getBody()));
        }
        return entries;
    }

    private static void closeQuietly(StatefulRedisConnection<String, String> candidate) {
        if (candidate == null) {
            return;
        }
        try {
            candidate.close();
        } catch (RuntimeException ex) {
            log.debug("Ignoring error while closing Redis connection: {}", ex.getMessage());
        }
    }
}
