package com.dendo.renkei.protocol.config;

import com.dendo.renkei.protocol.internal.exec.RenkeiTimingPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings the host supplies for one motor.
 *
 * @param host                     motor hostname or address
 * @param port                     TCP port, 17002 unless the motor was reconfigured
 * @param timingPolicy             timers for reconnect, health probing and timeouts
 * @param maxLineLength            longest inbound line accepted; longer lines are discarded
 * @param refreshStatusOnReconnect issue a {@code GET_STATUS} after every reconnection
 */
public record RenkeiClientConfig(
        String host,
        int port,
        RenkeiTimingPolicy timingPolicy,
        int maxLineLength,
        boolean refreshStatusOnReconnect
) {
    public static final int DEFAULT_PORT = 17002;
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;

    public static final String PROPERTY_PREFIX = "renkei.";

    public RenkeiClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxLineLength < 64) {
            throw new IllegalArgumentException("maxLineLength must be at least 64");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code renkei.*} keys. Durations are given in (possibly fractional) seconds:
     * <pre>
     *   renkei.host=192.168.1.50
     *   renkei.port=17002
     *   renkei.reconnect-interval-seconds=10
     *   renkei.health-check-interval-seconds=60
     *   renkei.connection-stabilise-delay-seconds=0.5
     *   renkei.command-timeout-seconds=10
     *   renkei.health-check-timeout-seconds=5
     *   renkei.connect-timeout-seconds=5
     *   renkei.max-line-length=8192
     *   renkei.refresh-status-on-reconnect=true
     * </pre>
     *
     * @throws IllegalArgumentException if {@code renkei.host} is missing or a value is malformed
     */
    public static RenkeiClientConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");

        String host = props.getProperty(PROPERTY_PREFIX + "host");
        if (host == null) {
            throw new IllegalArgumentException("Missing property " + PROPERTY_PREFIX + "host");
        }

        RenkeiTimingPolicy d = RenkeiTimingPolicy.defaults();
        RenkeiTimingPolicy timing = new RenkeiTimingPolicy(
                seconds(props, "reconnect-interval-seconds", d.reconnectInterval()),
                seconds(props, "health-check-interval-seconds", d.healthCheckInterval()),
                seconds(props, "connection-stabilise-delay-seconds", d.stabiliseDelay()),
                seconds(props, "command-timeout-seconds", d.commandTimeout()),
                seconds(props, "health-check-timeout-seconds", d.healthCheckTimeout()),
                seconds(props, "connect-timeout-seconds", d.connectTimeout()));

        return builder()
                .withHost(host.trim())
                .withPort(integer(props, "port", DEFAULT_PORT))
                .withTimingPolicy(timing)
                .withMaxLineLength(integer(props, "max-line-length", DEFAULT_MAX_LINE_LENGTH))
                .withRefreshStatusOnReconnect(Boolean.parseBoolean(
                        props.getProperty(PROPERTY_PREFIX + "refresh-status-on-reconnect", "true").trim()))
                .build();
    }

    /**
     * Loads a properties resource from the classpath and reads it with
     * {@link #fromProperties(Properties)}.
     */
    public static RenkeiClientConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = RenkeiClientConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static Duration seconds(Properties props, String key, Duration fallback) {
        String raw = props.getProperty(PROPERTY_PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        try {
            BigDecimal secs = new BigDecimal(raw.trim());
            return Duration.ofNanos(secs.movePointRight(9).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid " + PROPERTY_PREFIX + key + ": " + raw, e);
        }
    }

    private static int integer(Properties props, String key, int fallback) {
        String raw = props.getProperty(PROPERTY_PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PROPERTY_PREFIX + key + ": " + raw, e);
        }
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private RenkeiTimingPolicy timingPolicy = RenkeiTimingPolicy.defaults();
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private boolean refreshStatusOnReconnect = true;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTimingPolicy(RenkeiTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withRefreshStatusOnReconnect(boolean refresh) {
            this.refreshStatusOnReconnect = refresh;
            return this;
        }

        public RenkeiClientConfig build() {
            return new RenkeiClientConfig(host, port, timingPolicy, maxLineLength, refreshStatusOnReconnect);
        }
    }
}
