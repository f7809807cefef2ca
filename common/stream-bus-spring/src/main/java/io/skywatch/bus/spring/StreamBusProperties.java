package io.skywatch.bus.spring;

import io.skywatch.bus.BusSettings;
import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.StreamRetention;
import io.skywatch.bus.transport.RedisConnectionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Stream bus connection and retry settings bound from {@code skywatch.bus.*}.
 */
@Validated
@ConfigurationProperties(prefix = "skywatch.bus")
public class StreamBusProperties {

    public enum Mode {
        REDIS,
        MEMORY
    }

    private Mode mode = Mode.REDIS;
    @NotBlank
    private String host = "localhost";
    @Min(1)
    @Max(65535)
    private int port = 6379;
    private String username;
    private String password;
    private boolean ssl;
    @NotNull
    private Duration commandTimeout = Duration.ofSeconds(10);
    @Min(1)
    private int publishAttempts = 3;
    @Valid
    private final Backoff backoff = new Backoff();
    /**
     * Approximate max length per stream kind ({@code data}, {@code ctrl}, {@code status}); 0 keeps everything.
     */
    private Map<String, Long> retention = new LinkedHashMap<>(Map.of("data", 10_000L));

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = normalise(host);
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = normalise(username);
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = normalise(password);
    }

    public boolean isSsl() {
        return ssl;
    }

    public void setSsl(boolean ssl) {
        this.ssl = ssl;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public int getPublishAttempts() {
        return publishAttempts;
    }

    public void setPublishAttempts(int publishAttempts) {
        this.publishAttempts = publishAttempts;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public Map<String, Long> getRetention() {
        return retention;
    }

    public void setRetention(Map<String, Long> retention) {
        this.retention = retention == null ? new LinkedHashMap<>() : new LinkedHashMap<>(retention);
    }

    public BusSettings toBusSettings() {
        Map<String, Long> byPrefix = new LinkedHashMap<>();
        retention.forEach((kind, max) -> byPrefix.put(kind.endsWith(":") ? kind : kind + ":", max));
        return new BusSettings(publishAttempts, backoff.toBackoff(), new StreamRetention(byPrefix));
    }

    public RedisConnectionSettings toConnectionSettings() {
        return new RedisConnectionSettings(host, port, username, password, ssl, commandTimeout);
    }

    private static String normalise(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static class Backoff {

        @NotNull
        private Duration initial = Duration.ofMillis(200);
        @NotNull
        private Duration max = Duration.ofSeconds(10);
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        public Duration getInitial() {
            return initial;
        }

        public void setInitial(Duration initial) {
            this.initial = initial;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public ExponentialBackoff toBackoff() {
            return new ExponentialBackoff(initial, max, multiplier);
        }
    }
}
