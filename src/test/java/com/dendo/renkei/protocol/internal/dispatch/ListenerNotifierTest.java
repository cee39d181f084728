package com.dendo.renkei.protocol.internal.dispatch;

import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.protocol.observability.RecordingObservabilitySink;
import com.dendo.renkei.protocol.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ListenerNotifierTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualWallClock wallClock = new ManualWallClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<Runnable> queued = new ArrayList<>();
    private final ListenerNotifier notifier = new ListenerNotifier(queued::add, sink, wallClock);

    private void runQueued() {
        List<Runnable> tasks = new ArrayList<>(queued);
        queued.clear();
        tasks.forEach(Runnable::run);
    }

    @Test
    void callbacksRunOnTheCallbackExecutor() {
        List<ConnectionState> states = new ArrayList<>();
        notifier.setConnectionStateListener(states::add);

        notifier.publishConnectionState(ConnectionState.CONNECTING);
        assertTrue(states.isEmpty());

        runQueued();
        assertEquals(List.of(ConnectionState.CONNECTING), states);
    }

    @Test
    void listenerInstalledLaterSeesLaterPublications() {
        notifier.publishStatus(MotorStatus.empty());
        List<MotorStatus> seen = new ArrayList<>();
        notifier.setStatusListener(seen::add);

        runQueued();

        assertEquals(List.of(MotorStatus.empty()), seen);
    }

    @Test
    void replacingAndRemovingListener() {
        List<MotorStatus> first = new ArrayList<>();
        List<MotorStatus> second = new ArrayList<>();
        notifier.setStatusListener(first::add);
        notifier.setStatusListener(second::add);
        notifier.publishStatus(MotorStatus.empty());
        runQueued();

        notifier.setStatusListener(null);
        notifier.publishStatus(MotorStatus.empty());
        runQueued();

        assertTrue(first.isEmpty());
        assertEquals(1, second.size());
    }

    @Test
    void throwingListenerIsReported() {
        notifier.setConnectionStateListener(s -> {
            throw new IllegalStateException("boom");
        });

        notifier.publishConnectionState(ConnectionState.CONNECTED);
        runQueued();

        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(IllegalStateException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void rejectedExecutionIsReported() {
        ListenerNotifier closed = new ListenerNotifier(r -> {
            throw new RejectedExecutionException("shut down");
        }, sink, wallClock);

        closed.publishStatus(MotorStatus.empty());

        assertEquals(1, sink.getErrors().size());
    }
}
