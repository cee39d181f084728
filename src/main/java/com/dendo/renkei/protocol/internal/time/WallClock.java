package com.dendo.renkei.protocol.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for {@code lastSeen} and observability timestamps only.
 * May jump; never used for deadlines.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
