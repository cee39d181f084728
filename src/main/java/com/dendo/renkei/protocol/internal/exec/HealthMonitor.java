package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.api.CommandInFlightException;
import com.dendo.renkei.api.CommandTimeoutException;
import com.dendo.renkei.api.DeviceErrorException;
import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import com.dendo.renkei.protocol.internal.events.RenkeiEvent;
import com.dendo.renkei.protocol.internal.time.Cancellable;
import com.dendo.renkei.protocol.internal.time.MonotonicClock;
import com.dendo.renkei.protocol.internal.time.MonotonicScheduler;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiResponse;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiProtocolEvent;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * HealthMonitor
 * =============================================================================
 * Periodic {@code GET_INFO} liveness probe while a connection is usable.
 *
 * <h2>Cadence</h2>
 * One probe per {@code healthCheckInterval}. The next probe is armed once the
 * previous one has been answered, so probes never overlap. An interval of zero
 * disables the monitor entirely.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>answered: arm the next probe</li>
 *   <li>a caller's own {@code GET_INFO} is in flight: skip this tick</li>
 *   <li>timed out, or answered with a device error: submit
 *       {@link ConnectionEvent.HealthCheckFailed} and stop probing</li>
 *   <li>connection already gone: stop probing; the state machine has moved on</li>
 * </ul>
 *
 * <p>The monitor is bound to one connection generation at a time. Results that
 * arrive for an older generation are ignored.</p>
 */
public final class HealthMonitor
{
    /**
     * Path by which probes enter the normal command pipeline.
     */
    @FunctionalInterface
    public interface ProbeSender {
        CompletableFuture<RenkeiResponse> send(RenkeiCommand command, Duration timeout);
    }

    private static final long INACTIVE = -1L;

    private final RenkeiTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final ProbeSender probeSender;
    private final Consumer<RenkeiEvent> eventSink;
    private final RenkeiObservabilitySink observabilitySink;

    private final AtomicLong activeGeneration = new AtomicLong(INACTIVE);
    private volatile Cancellable nextProbe;

    public HealthMonitor(RenkeiTimingPolicy timingPolicy,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         WallClock wallClock,
                         ProbeSender probeSender,
                         Consumer<RenkeiEvent> eventSink,
                         RenkeiObservabilitySink observabilitySink) {
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.probeSender = Objects.requireNonNull(probeSender, "probeSender");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Starts probing on behalf of connection {@code generation}. No-op when disabled.
     */
    public void start(long generation) {
        if (!timingPolicy.healthCheckEnabled()) {
            return;
        }
        stop();
        activeGeneration.set(generation);
        arm(generation);
    }

    public void stop() {
        activeGeneration.set(INACTIVE);
        Cancellable c = nextProbe;
        nextProbe = null;
        if (c != null) {
            c.cancel();
        }
    }

    public boolean isActive() {
        return activeGeneration.get() != INACTIVE;
    }

    private void arm(long generation) {
        nextProbe = scheduler.scheduleAfter(timingPolicy.healthCheckInterval(), clock, () -> probe(generation));
    }

    private void probe(long generation) {
        if (activeGeneration.get() != generation) {
            return;
        }
        probeSender.send(RenkeiCommand.getInfo(), timingPolicy.healthCheckTimeout())
                .whenComplete((response, failure) -> onProbeResult(generation, failure));
    }

    private void onProbeResult(long generation, Throwable failure) {
        if (activeGeneration.get() != generation) {
            return;
        }

        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;

        if (cause == null || cause instanceof CommandInFlightException) {
            arm(generation);
            return;
        }

        if (cause instanceof CommandTimeoutException || cause instanceof DeviceErrorException) {
            activeGeneration.compareAndSet(generation, INACTIVE);
            observabilitySink.onProtocolEvent(new RenkeiProtocolEvent(
                    wallClock.now(), RenkeiProtocolEvent.Kind.HEALTH_PROBE_FAILED, cause.getMessage()));
            eventSink.accept(new ConnectionEvent.HealthCheckFailed(wallClock.now(), generation, cause));
            return;
        }

        // NotConnected or ConnectionLost: the connection is already being torn down.
        activeGeneration.compareAndSet(generation, INACTIVE);
    }
}
