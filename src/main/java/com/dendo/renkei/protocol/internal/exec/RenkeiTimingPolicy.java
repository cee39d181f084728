package com.dendo.renkei.protocol.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * RenkeiTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a motor connection.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>reconnectInterval</b>: fixed wait between a lost or failed connection
 *       and the next attempt. Retries are unbounded and do not back off.</li>
 *   <li><b>healthCheckInterval</b>: cadence of {@code GET_INFO} liveness probes
 *       while connected. {@link Duration#ZERO} disables probing.</li>
 *   <li><b>stabiliseDelay</b>: pause after the socket is established before the
 *       connection counts as usable. The firmware drops commands sent too early.</li>
 *   <li><b>commandTimeout</b>: per-command response deadline for caller commands.</li>
 *   <li><b>healthCheckTimeout</b>: response deadline for a health probe.</li>
 *   <li><b>connectTimeout</b>: limit for a single TCP connect attempt.</li>
 * </ul>
 */
public record RenkeiTimingPolicy(
        Duration reconnectInterval,
        Duration healthCheckInterval,
        Duration stabiliseDelay,
        Duration commandTimeout,
        Duration healthCheckTimeout,
        Duration connectTimeout
) {
    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_STABILISE_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    public RenkeiTimingPolicy {
        requireNonNegative(reconnectInterval, "reconnectInterval");
        requireNonNegative(healthCheckInterval, "healthCheckInterval");
        requireNonNegative(stabiliseDelay, "stabiliseDelay");
        requirePositive(commandTimeout, "commandTimeout");
        requirePositive(healthCheckTimeout, "healthCheckTimeout");
        requirePositive(connectTimeout, "connectTimeout");
    }

    public static RenkeiTimingPolicy defaults() {
        return new RenkeiTimingPolicy(
                DEFAULT_RECONNECT_INTERVAL,
                DEFAULT_HEALTH_CHECK_INTERVAL,
                DEFAULT_STABILISE_DELAY,
                DEFAULT_COMMAND_TIMEOUT,
                DEFAULT_HEALTH_CHECK_TIMEOUT,
                DEFAULT_CONNECT_TIMEOUT);
    }

    public boolean healthCheckEnabled() {
        return !healthCheckInterval.isZero();
    }

    public RenkeiTimingPolicy withReconnectInterval(Duration value) {
        return new RenkeiTimingPolicy(value, healthCheckInterval, stabiliseDelay,
                commandTimeout, healthCheckTimeout, connectTimeout);
    }

    public RenkeiTimingPolicy withHealthCheckInterval(Duration value) {
        return new RenkeiTimingPolicy(reconnectInterval, value, stabiliseDelay,
                commandTimeout, healthCheckTimeout, connectTimeout);
    }

    public RenkeiTimingPolicy withStabiliseDelay(Duration value) {
        return new RenkeiTimingPolicy(reconnectInterval, healthCheckInterval, value,
                commandTimeout, healthCheckTimeout, connectTimeout);
    }

    public RenkeiTimingPolicy withCommandTimeout(Duration value) {
        return new RenkeiTimingPolicy(reconnectInterval, healthCheckInterval, stabiliseDelay,
                value, healthCheckTimeout, connectTimeout);
    }

    public RenkeiTimingPolicy withHealthCheckTimeout(Duration value) {
        return new RenkeiTimingPolicy(reconnectInterval, healthCheckInterval, stabiliseDelay,
                commandTimeout, value, connectTimeout);
    }

    public RenkeiTimingPolicy withConnectTimeout(Duration value) {
        return new RenkeiTimingPolicy(reconnectInterval, healthCheckInterval, stabiliseDelay,
                commandTimeout, healthCheckTimeout, value);
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
