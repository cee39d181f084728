package com.dendo.renkei.protocol.internal.state;

import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.protocol.internal.events.ConnectionEvent;

import java.util.Objects;

import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.ABANDON_PENDING;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.ARM_RECONNECT;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.ARM_STABILISATION;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.CANCEL_TIMERS;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.CLOSE_TRANSPORT;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.OPEN_TRANSPORT;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.REFRESH_STATUS;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.START_HEALTH_MONITOR;
import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.STOP_HEALTH_MONITOR;

/**
 * ConnectionReducer
 * -----------------------------------------------------------------------------
 * Pure transition function of the connection state machine.
 *
 * <pre>
 *   DISCONNECTED --connect-------------------------------&gt; CONNECTING
 *   CONNECTING   --socket up------------------------------&gt; CONNECTING (stabilising)
 *   CONNECTING   --stabilised-----------------------------&gt; CONNECTED
 *   CONNECTING   --connect failed / socket lost-----------&gt; RECONNECTING
 *   CONNECTED    --socket lost / health check failed------&gt; RECONNECTING
 *   RECONNECTING --reconnect interval elapsed-------------&gt; CONNECTING
 *   any          --disconnect-----------------------------&gt; DISCONNECTED
 * </pre>
 *
 * <p>Pending commands are abandoned exactly when {@code CONNECTED} is left, and
 * on explicit disconnect. Events whose generation does not match the snapshot
 * belong to a superseded attempt and are ignored, as are events that make no
 * sense in the current state.</p>
 *
 * <p>No I/O, timers or threads: given a snapshot and an event, the result is
 * fully determined.</p>
 */
public final class ConnectionReducer
{
    /**
     * @param snapshot the new snapshot
     * @param intents  side effects the caller must carry out
     */
    public record Result(ConnectionSnapshot snapshot, ConnectionIntents intents) {

        public boolean stateChanged(ConnectionSnapshot previous) {
            return previous.state() != snapshot.state();
        }
    }

    public Result apply(ConnectionSnapshot snapshot, ConnectionEvent event) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(event, "event");

        if (event instanceof ConnectionEvent.ConnectRequested) {
            return onConnectRequested(snapshot);
        }
        if (event instanceof ConnectionEvent.DisconnectRequested) {
            return onDisconnectRequested(snapshot);
        }

        // Every other event belongs to one attempt.
        ConnectionEvent.Generational g = (ConnectionEvent.Generational) event;
        if (!snapshot.isCurrent(g.generation())) {
            return unchanged(snapshot);
        }

        if (event instanceof ConnectionEvent.TransportUp) {
            return onTransportUp(snapshot);
        }
        if (event instanceof ConnectionEvent.StabilisationElapsed) {
            return onStabilisationElapsed(snapshot);
        }
        if (event instanceof ConnectionEvent.ConnectFailed e) {
            return onAttemptFailed(snapshot, e.cause());
        }
        if (event instanceof ConnectionEvent.TransportDown e) {
            return onConnectionLost(snapshot, e.cause().orElse(null));
        }
        if (event instanceof ConnectionEvent.HealthCheckFailed e) {
            return onConnectionLost(snapshot, e.cause());
        }
        if (event instanceof ConnectionEvent.ReconnectDue) {
            return onReconnectDue(snapshot);
        }

        return unchanged(snapshot);
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    private Result onConnectRequested(ConnectionSnapshot s) {
        if (s.state() != ConnectionState.DISCONNECTED) {
            // Already connected or working on it.
            return unchanged(s);
        }
        ConnectionSnapshot next = new ConnectionSnapshot(ConnectionState.CONNECTING, s.generation() + 1, false);
        return new Result(next, intents().add(OPEN_TRANSPORT).build());
    }

    private Result onDisconnectRequested(ConnectionSnapshot s) {
        if (s.state() == ConnectionState.DISCONNECTED) {
            return unchanged(s);
        }
        return new Result(
                s.nextAttempt(ConnectionState.DISCONNECTED),
                intents()
                        .add(ABANDON_PENDING)
                        .add(STOP_HEALTH_MONITOR)
                        .add(CANCEL_TIMERS)
                        .add(CLOSE_TRANSPORT)
                        .build());
    }

    private Result onTransportUp(ConnectionSnapshot s) {
        if (s.state() != ConnectionState.CONNECTING) {
            return unchanged(s);
        }
        // Socket is up but the motor is not ready for commands yet.
        return new Result(s, intents().add(ARM_STABILISATION).build());
    }

    private Result onStabilisationElapsed(ConnectionSnapshot s) {
        if (s.state() != ConnectionState.CONNECTING) {
            return unchanged(s);
        }
        ConnectionIntents.Builder b = intents().add(START_HEALTH_MONITOR);
        if (s.everConnected()) {
            b.add(REFRESH_STATUS);
        }
        return new Result(s.connected(), b.build());
    }

    private Result onAttemptFailed(ConnectionSnapshot s, Throwable cause) {
        if (s.state() != ConnectionState.CONNECTING) {
            return unchanged(s);
        }
        return new Result(
                s.withState(ConnectionState.RECONNECTING),
                intents()
                        .add(CANCEL_TIMERS)
                        .add(CLOSE_TRANSPORT)
                        .add(ARM_RECONNECT)
                        .cause(cause)
                        .build());
    }

    private Result onConnectionLost(ConnectionSnapshot s, Throwable cause) {
        if (s.state() == ConnectionState.CONNECTING) {
            // Lost while stabilising: nothing can be pending yet.
            return onAttemptFailed(s, cause);
        }
        if (s.state() != ConnectionState.CONNECTED) {
            return unchanged(s);
        }
        return new Result(
                s.withState(ConnectionState.RECONNECTING),
                intents()
                        .add(ABANDON_PENDING)
                        .add(STOP_HEALTH_MONITOR)
                        .add(CLOSE_TRANSPORT)
                        .add(ARM_RECONNECT)
                        .cause(cause)
                        .build());
    }

    private Result onReconnectDue(ConnectionSnapshot s) {
        if (s.state() != ConnectionState.RECONNECTING) {
            return unchanged(s);
        }
        return new Result(s.nextAttempt(ConnectionState.CONNECTING), intents().add(OPEN_TRANSPORT).build());
    }

    private static Result unchanged(ConnectionSnapshot s) {
        return new Result(s, ConnectionIntents.none());
    }

    private static ConnectionIntents.Builder intents() {
        return ConnectionIntents.builder();
    }
}
