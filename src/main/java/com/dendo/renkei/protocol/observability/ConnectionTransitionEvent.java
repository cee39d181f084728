package com.dendo.renkei.protocol.observability;

import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import com.dendo.renkei.protocol.internal.state.ConnectionIntents;
import com.dendo.renkei.protocol.internal.state.ConnectionSnapshot;

import java.time.Instant;

/**
 * Record representing one reduction of the connection state machine.
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    ConnectionSnapshot oldSnapshot,
    ConnectionSnapshot newSnapshot,
    ConnectionEvent triggeringEvent,
    ConnectionIntents resultingIntents
) {
    public boolean isStateChange() {
        return oldSnapshot.state() != newSnapshot.state();
    }
}
