package io.skywatch.bus.transport;

import java.time.Duration;
import java.util.Objects;

public record RedisConnectionSettings(String host,
                                      int port,
                                      String username,
                                      String password,
                                      boolean ssl,
                                      Duration commandTimeout) {

    public RedisConnectionSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in 1..65535");
        }
        commandTimeout = Objects.requireNonNullElse(commandTimeout, Duration.ofSeconds(10));
    }

    public static RedisConnectionSettings of(String host, int port) {
        return new RedisConnectionSettings(host, port, null, null, false, Duration.ofSeconds(10));
    }
}
