package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.api.CommandInFlightException;
import com.dendo.renkei.api.ConnectionLostException;
import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.api.NotConnectedException;
import com.dendo.renkei.protocol.codec.RenkeiFrameDecoder;
import com.dendo.renkei.protocol.codec.RenkeiFrameEncoder;
import com.dendo.renkei.protocol.config.RenkeiClientConfig;
import com.dendo.renkei.protocol.internal.decode.MotorDataDecoder;
import com.dendo.renkei.protocol.internal.dispatch.EventDispatcher;
import com.dendo.renkei.protocol.internal.dispatch.ListenerNotifier;
import com.dendo.renkei.protocol.internal.events.CommandEvent;
import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import com.dendo.renkei.protocol.internal.events.FrameEvent;
import com.dendo.renkei.protocol.internal.events.RenkeiEvent;
import com.dendo.renkei.protocol.internal.state.ConnectionIntents;
import com.dendo.renkei.protocol.internal.state.ConnectionReducer;
import com.dendo.renkei.protocol.internal.state.ConnectionSnapshot;
import com.dendo.renkei.protocol.internal.time.MonotonicClock;
import com.dendo.renkei.protocol.internal.time.MonotonicScheduler;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.model.CommandName;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiResponse;
import com.dendo.renkei.protocol.observability.ConnectionTransitionEvent;
import com.dendo.renkei.protocol.observability.RenkeiErrorEvent;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiProtocolEvent;
import com.dendo.renkei.protocol.transport.StreamEndpoint;
import com.dendo.renkei.protocol.transport.TcpTransportAdapter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RenkeiConnectionDriver
 * =============================================================================
 * Serialized event loop that owns one motor connection.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Applies connection events through {@link ConnectionReducer} and has the
 *       resulting intents carried out</li>
 *   <li>Writes caller commands and tracks them in the {@link PendingCommandTable}</li>
 *   <li>Routes decoded frames through the {@link EventDispatcher}</li>
 *   <li>Expires commands whose deadline passed</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Callers, the I/O thread and timers only enqueue events. A single thread takes
 * them one at a time and is the only writer of the connection snapshot, the
 * pending-command table and the endpoint. Futures handed out by this class are
 * completed on that thread; the client facade relays them to its callback
 * executor before user code sees them.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()     → starts event loop thread
 *   driver.connect()   → enqueues a connect request
 *   driver.stop()      → disconnects, drains, stops the loop
 * </pre>
 *
 * <p>Tests may skip {@link #start()} and call {@link #processPendingEvents()} to
 * run the loop deterministically on the test thread.</p>
 */
public final class RenkeiConnectionDriver
{
    private static final long STOP_JOIN_MILLIS = 5000;

    private final RenkeiClientConfig config;
    private final StreamEndpoint endpoint;
    private final RenkeiFrameEncoder encoder;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final RenkeiObservabilitySink observabilitySink;

    private final ConnectionReducer reducer = new ConnectionReducer();
    private final PendingCommandTable pending;
    private final EventDispatcher dispatcher;
    private final ListenerNotifier notifier;
    private final ConnectionIntentExecutor intentExecutor;

    private final BlockingQueue<RenkeiEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Object stateLock = new Object();
    // Identity-compared; never reduced.
    private final RenkeiEvent stopMarker;

    // Driver thread only
    private final List<CompletableFuture<Void>> connectWaiters = new ArrayList<>();

    private ConnectionSnapshot snapshot = ConnectionSnapshot.initial();
    private volatile Instant lastSeen;
    private volatile Thread eventLoopThread;

    public RenkeiConnectionDriver(RenkeiClientConfig config,
                                  StreamEndpoint endpoint,
                                  RenkeiFrameEncoder encoder,
                                  RenkeiFrameDecoder decoder,
                                  ListenerNotifier notifier,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler,
                                  WallClock wallClock,
                                  RenkeiObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(decoder, "decoder");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.stopMarker = new ConnectionEvent.DisconnectRequested(wallClock.now());
        this.pending = new PendingCommandTable(clock);
        this.dispatcher = new EventDispatcher(new MotorDataDecoder(), notifier, observabilitySink, wallClock);

        String remote = config.host() + ":" + config.port();
        HealthMonitor healthMonitor = new HealthMonitor(
                config.timingPolicy(), clock, scheduler, wallClock,
                this::submitCommand, this::submitEvent, observabilitySink);
        this.intentExecutor = new TransportConnectionIntentExecutor(
                endpoint, healthMonitor, config.timingPolicy(), clock, scheduler, wallClock,
                this::submitEvent, observabilitySink, remote);

        endpoint.setListener(new TcpTransportAdapter(decoder, this::submitEvent, observabilitySink, wallClock, remote));
    }

    /**
     * Starts the event loop thread. Idempotent.
     */
    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::runEventLoop, "renkei-connection-driver");
        t.setDaemon(true);
        eventLoopThread = t;
        t.start();
    }

    /**
     * Disconnects, processes everything already queued and stops the loop.
     * Commands submitted afterwards fail with {@link NotConnectedException}.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        eventQueue.offer(new ConnectionEvent.DisconnectRequested(wallClock.now()));

        Thread t = eventLoopThread;
        if (t != null) {
            eventQueue.offer(stopMarker);
            try {
                t.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                t.interrupt();
            }
        } else {
            drainQueue();
        }

        intentExecutor.shutdown();
        rejectRemaining();
    }

    /**
     * Enqueues an event.
     *
     * @return {@code false} if the driver has been stopped and the event was dropped
     */
    public boolean submitEvent(RenkeiEvent event) {
        Objects.requireNonNull(event, "event");
        if (stopped.get()) {
            return false;
        }
        eventQueue.offer(event);
        return true;
    }

    /**
     * Requests a connection.
     *
     * @return completes the next time the connection reaches {@link ConnectionState#CONNECTED}
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> whenConnected = new CompletableFuture<>();
        if (!submitEvent(new ConnectionEvent.ConnectRequested(wallClock.now(), whenConnected))) {
            whenConnected.completeExceptionally(closed());
        }
        return whenConnected;
    }

    public void disconnect() {
        submitEvent(new ConnectionEvent.DisconnectRequested(wallClock.now()));
    }

    /**
     * Queues a command for writing.
     *
     * @return completes with the correlated response, or exceptionally
     */
    public CompletableFuture<RenkeiResponse> submitCommand(RenkeiCommand command, Duration timeout) {
        CompletableFuture<RenkeiResponse> result = new CompletableFuture<>();
        if (!submitEvent(new CommandEvent.CommandRequested(wallClock.now(), command, timeout, result))) {
            result.completeExceptionally(closed());
        }
        return result;
    }

    public ConnectionSnapshot snapshot() {
        synchronized (stateLock) {
            return snapshot;
        }
    }

    public ConnectionState state() {
        return snapshot().state();
    }

    public Optional<Instant> lastSeen() {
        return Optional.ofNullable(lastSeen);
    }

    /**
     * Processes queued events on the calling thread until the queue is empty.
     * Only valid while the loop thread has not been started.
     *
     * @return number of events processed
     */
    public int processPendingEvents() {
        if (started.get()) {
            throw new IllegalStateException("event loop thread is running");
        }
        return drainQueue();
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    private void runEventLoop() {
        while (true) {
            final RenkeiEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == stopMarker) {
                return;
            }
            processEvent(event);
        }
    }

    private int drainQueue() {
        int processed = 0;
        RenkeiEvent event;
        while ((event = eventQueue.poll()) != null) {
            if (event != stopMarker) {
                processEvent(event);
                processed++;
            }
        }
        return processed;
    }

    private void processEvent(RenkeiEvent event) {
        try {
            if (event instanceof ConnectionEvent e) {
                onConnectionEvent(e);
            } else if (event instanceof FrameEvent e) {
                onFrame(e);
            } else if (event instanceof CommandEvent.CommandRequested e) {
                onCommand(e);
            } else if (event instanceof CommandEvent.TimeoutSweepDue) {
                onTimeoutSweep();
            }
        } catch (RuntimeException e) {
            observabilitySink.onError(new RenkeiErrorEvent(wallClock.now(), "Event processing error", e));
        }
    }

    // ---------------------------------------------------------------------
    // Connection events
    // ---------------------------------------------------------------------

    private void onConnectionEvent(ConnectionEvent event) {
        if (event instanceof ConnectionEvent.ConnectRequested request) {
            connectWaiters.add(request.whenConnected());
        }

        final ConnectionSnapshot oldSnapshot;
        final ConnectionReducer.Result result;
        synchronized (stateLock) {
            oldSnapshot = snapshot;
            result = reducer.apply(oldSnapshot, event);
            snapshot = result.snapshot();
        }
        ConnectionSnapshot newSnapshot = result.snapshot();
        ConnectionIntents intents = result.intents();

        observabilitySink.onStateTransition(new ConnectionTransitionEvent(
                wallClock.now(), oldSnapshot, newSnapshot, event, intents));

        if (intents.contains(ConnectionIntents.Kind.ABANDON_PENDING)) {
            abandonPending(event, intents);
        }
        if (!intents.isEmpty()) {
            intentExecutor.execute(intents, newSnapshot);
        }
        if (result.stateChanged(oldSnapshot)) {
            if (oldSnapshot.state() == ConnectionState.CONNECTED) {
                dispatcher.connectionLost();
            }
            notifier.publishConnectionState(newSnapshot.state());
        }

        if (newSnapshot.state() == ConnectionState.CONNECTED) {
            completeConnectWaiters();
        } else if (event instanceof ConnectionEvent.DisconnectRequested) {
            failConnectWaiters();
        }

        if (intents.contains(ConnectionIntents.Kind.REFRESH_STATUS) && config.refreshStatusOnReconnect()) {
            refreshStatus();
        }
    }

    private void abandonPending(ConnectionEvent event, ConnectionIntents intents) {
        ConnectionLostException cause = event instanceof ConnectionEvent.DisconnectRequested
                ? new ConnectionLostException("Disconnected")
                : new ConnectionLostException("Connection lost", intents.cause().orElse(null));
        pending.abandonAll(cause);
    }

    private void completeConnectWaiters() {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        waiters.forEach(w -> w.complete(null));
    }

    private void failConnectWaiters() {
        List<CompletableFuture<Void>> waiters = new ArrayList<>(connectWaiters);
        connectWaiters.clear();
        NotConnectedException cause = new NotConnectedException(
                ConnectionState.DISCONNECTED, "Disconnected before the connection was established");
        waiters.forEach(w -> w.completeExceptionally(cause));
    }

    private void refreshStatus() {
        if (pending.isPending(CommandName.GET_STATUS.wireName())) {
            return;
        }
        onCommand(new CommandEvent.CommandRequested(
                wallClock.now(),
                RenkeiCommand.getStatus(),
                config.timingPolicy().commandTimeout(),
                new CompletableFuture<>()));
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private void onCommand(CommandEvent.CommandRequested request) {
        RenkeiCommand command = request.command();
        CompletableFuture<RenkeiResponse> result = request.result();
        String name = command.name().wireName();

        ConnectionState state = snapshot.state();
        if (state != ConnectionState.CONNECTED) {
            result.completeExceptionally(notConnected(state));
            return;
        }

        final byte[] line;
        try {
            line = encoder.encode(command);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        if (!command.expectsResponse()) {
            if (endpoint.send(line)) {
                report(RenkeiProtocolEvent.Kind.COMMAND_SENT, name);
                result.complete(null);
            } else {
                result.completeExceptionally(new ConnectionLostException("Connection closed before " + name + " was sent"));
            }
            return;
        }

        final PendingCommand registered;
        try {
            registered = pending.register(name, request.timeout(), result);
        } catch (CommandInFlightException e) {
            result.completeExceptionally(e);
            return;
        }

        if (!endpoint.send(line)) {
            pending.fail(name, new ConnectionLostException("Connection closed before " + name + " was sent"));
            return;
        }
        report(RenkeiProtocolEvent.Kind.COMMAND_SENT, name + " " + command.params());

        scheduler.scheduleAtNanos(registered.deadlineNanos(),
                () -> submitEvent(new CommandEvent.TimeoutSweepDue(wallClock.now())));
    }

    private void onTimeoutSweep() {
        for (String name : pending.timeoutSweep(clock.nowNanos())) {
            report(RenkeiProtocolEvent.Kind.COMMAND_TIMEOUT, name);
        }
    }

    // ---------------------------------------------------------------------
    // Frames
    // ---------------------------------------------------------------------

    private void onFrame(FrameEvent event) {
        ConnectionSnapshot s = snapshot;
        if (!s.isCurrent(event.generation())) {
            return;
        }
        if (s.state() != ConnectionState.CONNECTED && s.state() != ConnectionState.CONNECTING) {
            return;
        }
        lastSeen = wallClock.now();
        dispatcher.dispatch(event.frame(), pending);
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    private void rejectRemaining() {
        RenkeiEvent event;
        while ((event = eventQueue.poll()) != null) {
            if (event instanceof CommandEvent.CommandRequested request) {
                request.result().completeExceptionally(closed());
            } else if (event instanceof ConnectionEvent.ConnectRequested request) {
                request.whenConnected().completeExceptionally(closed());
            }
        }
        failConnectWaiters();
    }

    private static NotConnectedException notConnected(ConnectionState state) {
        if (state == ConnectionState.CONNECTING) {
            return new NotConnectedException(state, "Connection not yet ready");
        }
        return new NotConnectedException(state, "Not connected (" + state + ")");
    }

    private static NotConnectedException closed() {
        return new NotConnectedException(ConnectionState.DISCONNECTED, "Client is closed");
    }

    private void report(RenkeiProtocolEvent.Kind kind, String detail) {
        observabilitySink.onProtocolEvent(new RenkeiProtocolEvent(wallClock.now(), kind, detail));
    }
}
