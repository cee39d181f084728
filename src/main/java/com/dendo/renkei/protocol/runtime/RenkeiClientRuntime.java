package com.dendo.renkei.protocol.runtime;

import com.dendo.renkei.protocol.codec.RenkeiFrameDecoder;
import com.dendo.renkei.protocol.codec.RenkeiFrameEncoder;
import com.dendo.renkei.protocol.codec.impl.JacksonRenkeiFrameDecoder;
import com.dendo.renkei.protocol.codec.impl.JacksonRenkeiFrameEncoder;
import com.dendo.renkei.protocol.config.RenkeiClientConfig;
import com.dendo.renkei.protocol.internal.dispatch.ListenerNotifier;
import com.dendo.renkei.protocol.internal.exec.RenkeiConnectionDriver;
import com.dendo.renkei.protocol.internal.time.MonotonicClock;
import com.dendo.renkei.protocol.internal.time.MonotonicScheduler;
import com.dendo.renkei.protocol.internal.time.ScheduledExecutorScheduler;
import com.dendo.renkei.protocol.internal.time.SystemMonotonicClock;
import com.dendo.renkei.protocol.internal.time.SystemWallClock;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.observability.NullObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.transport.StreamEndpoint;
import com.dendo.renkei.protocol.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * RenkeiClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one motor connection.
 *
 * <p>Owns four kinds of thread: the Netty I/O loop (inside the endpoint), the
 * driver's event loop, one timer thread and one callback thread. Components
 * supplied through the builder are used as-is and are not shut down by
 * {@link #stop()}; everything the builder creates itself is.</p>
 */
public final class RenkeiClientRuntime {
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final RenkeiClientConfig config;
    private final RenkeiConnectionDriver driver;
    private final StreamEndpoint endpoint;
    private final ListenerNotifier notifier;
    private final Executor callbackExecutor;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final ExecutorService ownedCallbackExecutor;

    private RenkeiClientRuntime(
            RenkeiClientConfig config,
            RenkeiConnectionDriver driver,
            StreamEndpoint endpoint,
            ListenerNotifier notifier,
            Executor callbackExecutor,
            ScheduledExecutorService ownedSchedulerExecutor,
            ExecutorService ownedCallbackExecutor) {
        this.config = config;
        this.driver = driver;
        this.endpoint = endpoint;
        this.notifier = notifier;
        this.callbackExecutor = callbackExecutor;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
        this.ownedCallbackExecutor = ownedCallbackExecutor;
    }

    public void start() {
        driver.start();
    }

    /**
     * Disconnects and releases every thread this runtime created.
     */
    public void stop() {
        driver.stop();
        endpoint.shutdown();
        if (ownedSchedulerExecutor != null) {
            shutdown(ownedSchedulerExecutor);
        }
        // Last, so continuations of futures failed during stop() still run.
        if (ownedCallbackExecutor != null) {
            shutdown(ownedCallbackExecutor);
        }
    }

    public RenkeiClientConfig config() {
        return config;
    }

    public RenkeiConnectionDriver driver() {
        return driver;
    }

    public ListenerNotifier notifier() {
        return notifier;
    }

    public Executor callbackExecutor() {
        return callbackExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private RenkeiClientConfig config;
        private RenkeiObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private StreamEndpoint endpoint;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private WallClock wallClock;
        private Executor callbackExecutor;
        private RenkeiFrameEncoder encoder;
        private RenkeiFrameDecoder decoder;

        public Builder withConfig(RenkeiClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RenkeiObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Clock and scheduler must agree; supply both or neither.
         */
        public Builder withTime(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withCallbackExecutor(Executor executor) {
            this.callbackExecutor = executor;
            return this;
        }

        public Builder withCodec(RenkeiFrameEncoder encoder, RenkeiFrameDecoder decoder) {
            this.encoder = encoder;
            this.decoder = decoder;
            return this;
        }

        public RenkeiClientRuntime build() {
            Objects.requireNonNull(config, "config");
            RenkeiObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            if ((clock == null) != (scheduler == null)) {
                throw new IllegalStateException("clock and scheduler must be supplied together");
            }

            // 1. Time
            MonotonicClock c = clock;
            MonotonicScheduler s = scheduler;
            ScheduledExecutorService ownedScheduler = null;
            if (c == null) {
                c = SystemMonotonicClock.INSTANCE;
                ownedScheduler = Executors.newSingleThreadScheduledExecutor(daemon("renkei-timer"));
                s = new ScheduledExecutorScheduler(ownedScheduler, c);
            }
            WallClock wc = wallClock != null ? wallClock : SystemWallClock.INSTANCE;

            // 2. Callbacks
            Executor callbacks = callbackExecutor;
            ExecutorService ownedCallbacks = null;
            if (callbacks == null) {
                ownedCallbacks = Executors.newSingleThreadExecutor(daemon("renkei-callbacks"));
                callbacks = ownedCallbacks;
            }
            ListenerNotifier notifier = new ListenerNotifier(callbacks, sink, wc);

            // 3. Transport and codec
            StreamEndpoint ep = endpoint != null ? endpoint : new NettyTcpStreamEndpoint(config);
            RenkeiFrameEncoder enc = encoder != null ? encoder : new JacksonRenkeiFrameEncoder();
            RenkeiFrameDecoder dec = decoder != null ? decoder : new JacksonRenkeiFrameDecoder();

            // 4. Driver
            RenkeiConnectionDriver driver = new RenkeiConnectionDriver(
                    config, ep, enc, dec, notifier, c, s, wc, sink);

            return new RenkeiClientRuntime(config, driver, ep, notifier, callbacks, ownedScheduler, ownedCallbacks);
        }
    }
}
