package com.dendo.renkei.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational deadline in the client: command timeouts,
 * the stabilisation delay, the reconnect interval and health-probe cadence.
 *
 * <p>Wall-clock time is never used for those decisions; it is reserved for
 * {@code lastSeen} and observability timestamps (see {@link WallClock}).</p>
 */
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick in nanoseconds. Only differences are meaningful.
     */
    long nowNanos();
}
