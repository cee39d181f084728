package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import com.dendo.renkei.protocol.internal.events.RenkeiEvent;
import com.dendo.renkei.protocol.internal.state.ConnectionIntents;
import com.dendo.renkei.protocol.internal.state.ConnectionSnapshot;
import com.dendo.renkei.protocol.internal.time.Cancellable;
import com.dendo.renkei.protocol.internal.time.MonotonicClock;
import com.dendo.renkei.protocol.internal.time.MonotonicScheduler;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiTransportEvent;
import com.dendo.renkei.protocol.transport.StreamEndpoint;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * TransportConnectionIntentExecutor
 * =============================================================================
 * Realises connection intents against a {@link StreamEndpoint}, the monotonic
 * scheduler and the {@link HealthMonitor}.
 *
 * <p>Timers never touch state. When the stabilisation delay or reconnect
 * interval elapses, the timer submits an event carrying the generation it was
 * armed for, and the reducer decides whether it still applies.</p>
 */
public final class TransportConnectionIntentExecutor implements ConnectionIntentExecutor
{
    private final StreamEndpoint endpoint;
    private final HealthMonitor healthMonitor;
    private final RenkeiTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final Consumer<RenkeiEvent> eventSink;
    private final RenkeiObservabilitySink observabilitySink;
    private final String remote;

    private Cancellable stabilisationTimer;
    private Cancellable reconnectTimer;

    public TransportConnectionIntentExecutor(StreamEndpoint endpoint,
                                             HealthMonitor healthMonitor,
                                             RenkeiTimingPolicy timingPolicy,
                                             MonotonicClock clock,
                                             MonotonicScheduler scheduler,
                                             WallClock wallClock,
                                             Consumer<RenkeiEvent> eventSink,
                                             RenkeiObservabilitySink observabilitySink,
                                             String remote) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    @Override
    public void execute(ConnectionIntents intents, ConnectionSnapshot snapshot) {
        long generation = snapshot.generation();

        for (ConnectionIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case STOP_HEALTH_MONITOR -> healthMonitor.stop();
                case CANCEL_TIMERS -> cancelTimers();
                case CLOSE_TRANSPORT -> endpoint.close();
                case OPEN_TRANSPORT -> {
                    observabilitySink.onTransportEvent(new RenkeiTransportEvent(
                            wallClock.now(), RenkeiTransportEvent.Kind.CONNECTING, remote, generation, null));
                    endpoint.connect(generation);
                }
                case ARM_STABILISATION -> stabilisationTimer = scheduler.scheduleAfter(
                        timingPolicy.stabiliseDelay(), clock,
                        () -> eventSink.accept(new ConnectionEvent.StabilisationElapsed(wallClock.now(), generation)));
                case ARM_RECONNECT -> reconnectTimer = scheduler.scheduleAfter(
                        timingPolicy.reconnectInterval(), clock,
                        () -> eventSink.accept(new ConnectionEvent.ReconnectDue(wallClock.now(), generation)));
                case START_HEALTH_MONITOR -> healthMonitor.start(generation);
                default -> {
                    // ABANDON_PENDING and REFRESH_STATUS belong to the driver.
                }
            }
        }
    }

    @Override
    public void shutdown() {
        healthMonitor.stop();
        cancelTimers();
    }

    private void cancelTimers() {
        if (stabilisationTimer != null) {
            stabilisationTimer.cancel();
            stabilisationTimer = null;
        }
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }
}
