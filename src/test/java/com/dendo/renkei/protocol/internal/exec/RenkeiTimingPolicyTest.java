package com.dendo.renkei.protocol.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RenkeiTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates timing policy defaults, validation and copy-with methods.
 */
class RenkeiTimingPolicyTest {

    @Test
    void defaultsMatchDeviceBehaviour() {
        RenkeiTimingPolicy policy = RenkeiTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.reconnectInterval());
        assertEquals(Duration.ofSeconds(60), policy.healthCheckInterval());
        assertEquals(Duration.ofMillis(500), policy.stabiliseDelay());
        assertEquals(Duration.ofSeconds(10), policy.commandTimeout());
        assertEquals(Duration.ofSeconds(5), policy.healthCheckTimeout());
        assertEquals(Duration.ofSeconds(5), policy.connectTimeout());
        assertTrue(policy.healthCheckEnabled());
    }

    @Test
    void zeroHealthIntervalDisablesHealthChecks() {
        RenkeiTimingPolicy policy = RenkeiTimingPolicy.defaults().withHealthCheckInterval(Duration.ZERO);

        assertFalse(policy.healthCheckEnabled());
    }

    @Test
    void zeroDelaysAreAccepted() {
        RenkeiTimingPolicy policy = RenkeiTimingPolicy.defaults()
                .withReconnectInterval(Duration.ZERO)
                .withStabiliseDelay(Duration.ZERO);

        assertEquals(Duration.ZERO, policy.reconnectInterval());
        assertEquals(Duration.ZERO, policy.stabiliseDelay());
    }

    @Test
    void canonicalConstructorRejectsNulls() {
        Duration s = Duration.ofSeconds(1);
        assertThrows(NullPointerException.class, () -> new RenkeiTimingPolicy(null, s, s, s, s, s));
        assertThrows(NullPointerException.class, () -> new RenkeiTimingPolicy(s, s, s, null, s, s));
        assertThrows(NullPointerException.class, () -> new RenkeiTimingPolicy(s, s, s, s, s, null));
    }

    @Test
    void negativeDelaysAreRejected() {
        RenkeiTimingPolicy d = RenkeiTimingPolicy.defaults();
        Duration negative = Duration.ofMillis(-1);

        assertThrows(IllegalArgumentException.class, () -> d.withReconnectInterval(negative));
        assertThrows(IllegalArgumentException.class, () -> d.withHealthCheckInterval(negative));
        assertThrows(IllegalArgumentException.class, () -> d.withStabiliseDelay(negative));
    }

    @Test
    void timeoutsMustBePositive() {
        RenkeiTimingPolicy d = RenkeiTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withCommandTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> d.withHealthCheckTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> d.withConnectTimeout(Duration.ofSeconds(-1)));
    }

    @Test
    void withMethodsReplaceOnlyOneField() {
        RenkeiTimingPolicy policy = RenkeiTimingPolicy.defaults().withCommandTimeout(Duration.ofSeconds(3));

        assertEquals(Duration.ofSeconds(3), policy.commandTimeout());
        assertEquals(RenkeiTimingPolicy.defaults().withCommandTimeout(Duration.ofSeconds(3)), policy);
        assertEquals(RenkeiTimingPolicy.DEFAULT_HEALTH_CHECK_TIMEOUT, policy.healthCheckTimeout());
    }
}
