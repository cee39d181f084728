package com.dendo.renkei.protocol.internal.state;

import com.dendo.renkei.api.ConnectionState;

import java.util.Objects;

/**
 * ConnectionSnapshot
 * -----------------------------------------------------------------------------
 * Immutable state consumed and produced by {@link ConnectionReducer}.
 *
 * @param state         the externally visible connection state
 * @param generation    identifier of the current connection attempt; bumped on
 *                      every new attempt and on disconnect so that events from a
 *                      superseded socket or timer no longer match
 * @param everConnected whether {@link ConnectionState#CONNECTED} has been reached
 *                      since the last explicit connect, which makes the next
 *                      {@code CONNECTED} a reconnection
 */
public record ConnectionSnapshot(ConnectionState state, long generation, boolean everConnected)
{
    public ConnectionSnapshot {
        Objects.requireNonNull(state, "state");
    }

    public static ConnectionSnapshot initial() {
        return new ConnectionSnapshot(ConnectionState.DISCONNECTED, 0L, false);
    }

    public boolean isCurrent(long eventGeneration) {
        return eventGeneration == generation;
    }

    ConnectionSnapshot withState(ConnectionState newState) {
        return new ConnectionSnapshot(newState, generation, everConnected);
    }

    ConnectionSnapshot nextAttempt(ConnectionState newState) {
        return new ConnectionSnapshot(newState, generation + 1, everConnected);
    }

    ConnectionSnapshot connected() {
        return new ConnectionSnapshot(ConnectionState.CONNECTED, generation, true);
    }
}
