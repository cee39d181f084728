package com.dendo.renkei.protocol.internal.dispatch;

import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.api.ConnectionStateListener;
import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.api.MotorStatusListener;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.observability.RenkeiErrorEvent;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands listener callbacks to the client's callback executor.
 *
 * <p>Listeners never run on the driver or I/O thread. With a single-threaded
 * executor they run in publication order. A listener that throws is reported to
 * the observability sink and stays installed.</p>
 */
public final class ListenerNotifier
{
    private final Executor callbackExecutor;
    private final RenkeiObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private volatile MotorStatusListener statusListener;
    private volatile ConnectionStateListener connectionStateListener;

    public ListenerNotifier(Executor callbackExecutor, RenkeiObservabilitySink observabilitySink, WallClock wallClock) {
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public void setStatusListener(MotorStatusListener listener) {
        this.statusListener = listener;
    }

    public void setConnectionStateListener(ConnectionStateListener listener) {
        this.connectionStateListener = listener;
    }

    public void publishStatus(MotorStatus status) {
        Objects.requireNonNull(status, "status");
        run("status listener", () -> {
            MotorStatusListener l = statusListener;
            if (l != null) {
                l.onStatus(status);
            }
        });
    }

    public void publishConnectionState(ConnectionState state) {
        Objects.requireNonNull(state, "state");
        run("connection state listener", () -> {
            ConnectionStateListener l = connectionStateListener;
            if (l != null) {
                l.onConnectionState(state);
            }
        });
    }

    private void run(String what, Runnable callback) {
        try {
            callbackExecutor.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    observabilitySink.onError(new RenkeiErrorEvent(wallClock.now(), what + " threw", e));
                }
            });
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new RenkeiErrorEvent(wallClock.now(), what + " not invoked: client closed", e));
        }
    }
}
