package com.dendo.renkei.protocol.internal.state;

import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.concurrent.CompletableFuture;

import static com.dendo.renkei.protocol.internal.state.ConnectionIntents.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure connection state reducer.
 *
 * No transports, timers or threads: given a prior snapshot and an event, the
 * reducer must produce the expected snapshot and intents.
 */
class ConnectionReducerTest {

    private ConnectionReducer reducer;
    private Instant now;

    @BeforeEach
    void setUp() {
        reducer = new ConnectionReducer();
        now = Instant.parse("2024-01-01T00:00:00Z");
    }

    private ConnectionEvent connect() {
        return new ConnectionEvent.ConnectRequested(now, new CompletableFuture<>());
    }

    private ConnectionSnapshot connecting(long generation, boolean everConnected) {
        return new ConnectionSnapshot(ConnectionState.CONNECTING, generation, everConnected);
    }

    private ConnectionSnapshot connected(long generation) {
        return new ConnectionSnapshot(ConnectionState.CONNECTED, generation, true);
    }

    // ---------------------------------------------------------------------
    // Connect / disconnect
    // ---------------------------------------------------------------------

    @Test
    void connectFromDisconnectedOpensTransportWithNewGeneration() {
        ConnectionReducer.Result r = reducer.apply(ConnectionSnapshot.initial(), connect());

        assertEquals(new ConnectionSnapshot(ConnectionState.CONNECTING, 1, false), r.snapshot());
        assertEquals(EnumSet.of(OPEN_TRANSPORT), r.intents().kinds());
        assertTrue(r.stateChanged(ConnectionSnapshot.initial()));
    }

    @Test
    void connectResetsReconnectionHistory() {
        ConnectionSnapshot afterDisconnect = new ConnectionSnapshot(ConnectionState.DISCONNECTED, 4, true);

        ConnectionReducer.Result r = reducer.apply(afterDisconnect, connect());

        assertEquals(new ConnectionSnapshot(ConnectionState.CONNECTING, 5, false), r.snapshot());
    }

    @Test
    void connectWhileActiveIsIgnored() {
        for (ConnectionSnapshot s : new ConnectionSnapshot[] {
                connecting(1, false),
                connected(1),
                new ConnectionSnapshot(ConnectionState.RECONNECTING, 1, true)}) {
            ConnectionReducer.Result r = reducer.apply(s, connect());
            assertSame(s, r.snapshot());
            assertTrue(r.intents().isEmpty());
        }
    }

    @Test
    void disconnectTearsEverythingDownAndBumpsGeneration() {
        ConnectionReducer.Result r = reducer.apply(connected(3), new ConnectionEvent.DisconnectRequested(now));

        assertEquals(ConnectionState.DISCONNECTED, r.snapshot().state());
        assertEquals(4, r.snapshot().generation());
        assertEquals(EnumSet.of(ABANDON_PENDING, STOP_HEALTH_MONITOR, CANCEL_TIMERS, CLOSE_TRANSPORT),
                r.intents().kinds());
    }

    @Test
    void disconnectWhileReconnectingCancelsTimers() {
        ConnectionSnapshot s = new ConnectionSnapshot(ConnectionState.RECONNECTING, 2, true);

        ConnectionReducer.Result r = reducer.apply(s, new ConnectionEvent.DisconnectRequested(now));

        assertEquals(ConnectionState.DISCONNECTED, r.snapshot().state());
        assertTrue(r.intents().contains(CANCEL_TIMERS));
    }

    @Test
    void disconnectWhenAlreadyDisconnectedDoesNothing() {
        ConnectionReducer.Result r = reducer.apply(ConnectionSnapshot.initial(), new ConnectionEvent.DisconnectRequested(now));

        assertEquals(ConnectionSnapshot.initial(), r.snapshot());
        assertTrue(r.intents().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Establishment
    // ---------------------------------------------------------------------

    @Test
    void transportUpArmsStabilisationWithoutChangingState() {
        ConnectionSnapshot s = connecting(1, false);

        ConnectionReducer.Result r = reducer.apply(s, new ConnectionEvent.TransportUp(now, 1));

        assertEquals(s, r.snapshot());
        assertEquals(EnumSet.of(ARM_STABILISATION), r.intents().kinds());
        assertFalse(r.stateChanged(s));
    }

    @Test
    void stabilisationCompletesFirstConnection() {
        ConnectionReducer.Result r = reducer.apply(connecting(1, false), new ConnectionEvent.StabilisationElapsed(now, 1));

        assertEquals(connected(1), r.snapshot());
        assertEquals(EnumSet.of(START_HEALTH_MONITOR), r.intents().kinds());
    }

    @Test
    void stabilisationAfterReconnectRequestsStatusRefresh() {
        ConnectionReducer.Result r = reducer.apply(connecting(2, true), new ConnectionEvent.StabilisationElapsed(now, 2));

        assertEquals(ConnectionState.CONNECTED, r.snapshot().state());
        assertEquals(EnumSet.of(START_HEALTH_MONITOR, REFRESH_STATUS), r.intents().kinds());
    }

    @Test
    void connectFailureSchedulesReconnect() {
        ConnectException cause = new ConnectException("refused");

        ConnectionReducer.Result r = reducer.apply(connecting(1, false), new ConnectionEvent.ConnectFailed(now, 1, cause));

        assertEquals(new ConnectionSnapshot(ConnectionState.RECONNECTING, 1, false), r.snapshot());
        assertEquals(EnumSet.of(CANCEL_TIMERS, CLOSE_TRANSPORT, ARM_RECONNECT), r.intents().kinds());
        assertSame(cause, r.intents().cause().orElseThrow());
    }

    @Test
    void lossDuringStabilisationDoesNotAbandonPending() {
        ConnectionReducer.Result r = reducer.apply(connecting(1, false),
                new ConnectionEvent.TransportDown(now, 1, null));

        assertEquals(ConnectionState.RECONNECTING, r.snapshot().state());
        assertFalse(r.intents().contains(ABANDON_PENDING));
        assertTrue(r.intents().contains(CANCEL_TIMERS));
        assertTrue(r.intents().cause().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Loss and recovery
    // ---------------------------------------------------------------------

    @Test
    void transportDownWhileConnectedAbandonsPendingAndReconnects() {
        IOException cause = new IOException("reset");

        ConnectionReducer.Result r = reducer.apply(connected(1), new ConnectionEvent.TransportDown(now, 1, cause));

        assertEquals(new ConnectionSnapshot(ConnectionState.RECONNECTING, 1, true), r.snapshot());
        assertEquals(EnumSet.of(ABANDON_PENDING, STOP_HEALTH_MONITOR, CLOSE_TRANSPORT, ARM_RECONNECT),
                r.intents().kinds());
        assertSame(cause, r.intents().cause().orElseThrow());
    }

    @Test
    void failedHealthCheckIsTreatedAsConnectionLoss() {
        RuntimeException cause = new RuntimeException("probe timed out");

        ConnectionReducer.Result r = reducer.apply(connected(1), new ConnectionEvent.HealthCheckFailed(now, 1, cause));

        assertEquals(ConnectionState.RECONNECTING, r.snapshot().state());
        assertTrue(r.intents().contains(ABANDON_PENDING));
        assertTrue(r.intents().contains(ARM_RECONNECT));
    }

    @Test
    void reconnectDueOpensNextGeneration() {
        ConnectionSnapshot s = new ConnectionSnapshot(ConnectionState.RECONNECTING, 1, true);

        ConnectionReducer.Result r = reducer.apply(s, new ConnectionEvent.ReconnectDue(now, 1));

        assertEquals(connecting(2, true), r.snapshot());
        assertEquals(EnumSet.of(OPEN_TRANSPORT), r.intents().kinds());
    }

    // ---------------------------------------------------------------------
    // Stale and out-of-place events
    // ---------------------------------------------------------------------

    @Test
    void eventsFromSupersededGenerationAreIgnored() {
        ConnectionSnapshot s = connected(2);

        assertTrue(reducer.apply(s, new ConnectionEvent.TransportDown(now, 1, null)).intents().isEmpty());
        assertTrue(reducer.apply(s, new ConnectionEvent.HealthCheckFailed(now, 1, new RuntimeException())).intents().isEmpty());
        assertSame(s, reducer.apply(s, new ConnectionEvent.TransportDown(now, 1, null)).snapshot());
    }

    @Test
    void staleStabilisationTimerDoesNotPromote() {
        ConnectionSnapshot s = connecting(3, true);

        ConnectionReducer.Result r = reducer.apply(s, new ConnectionEvent.StabilisationElapsed(now, 2));

        assertSame(s, r.snapshot());
    }

    @Test
    void eventsThatDoNotFitTheStateAreIgnored() {
        ConnectionSnapshot c = connected(1);
        assertTrue(reducer.apply(c, new ConnectionEvent.TransportUp(now, 1)).intents().isEmpty());
        assertTrue(reducer.apply(c, new ConnectionEvent.StabilisationElapsed(now, 1)).intents().isEmpty());
        assertTrue(reducer.apply(c, new ConnectionEvent.ReconnectDue(now, 1)).intents().isEmpty());
        assertTrue(reducer.apply(c, new ConnectionEvent.ConnectFailed(now, 1, new IOException())).intents().isEmpty());

        ConnectionSnapshot r = new ConnectionSnapshot(ConnectionState.RECONNECTING, 1, true);
        assertTrue(reducer.apply(r, new ConnectionEvent.TransportDown(now, 1, null)).intents().isEmpty());
    }

    @Test
    void fullCycleKeepsGenerationsMonotonic() {
        ConnectionSnapshot s = ConnectionSnapshot.initial();
        s = reducer.apply(s, connect()).snapshot();
        s = reducer.apply(s, new ConnectionEvent.TransportUp(now, 1)).snapshot();
        s = reducer.apply(s, new ConnectionEvent.StabilisationElapsed(now, 1)).snapshot();
        s = reducer.apply(s, new ConnectionEvent.TransportDown(now, 1, null)).snapshot();
        s = reducer.apply(s, new ConnectionEvent.ReconnectDue(now, 1)).snapshot();
        s = reducer.apply(s, new ConnectionEvent.TransportUp(now, 2)).snapshot();
        ConnectionReducer.Result last = reducer.apply(s, new ConnectionEvent.StabilisationElapsed(now, 2));

        assertEquals(connected(2), last.snapshot());
        assertTrue(last.intents().contains(REFRESH_STATUS));
    }
}
