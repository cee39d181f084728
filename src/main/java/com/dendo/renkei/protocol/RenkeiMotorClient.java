package com.dendo.renkei.protocol;

import com.dendo.renkei.api.ConnectionState;
import com.dendo.renkei.api.ConnectionStateListener;
import com.dendo.renkei.api.MotorClient;
import com.dendo.renkei.api.MotorInfo;
import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.api.MotorStatusListener;
import com.dendo.renkei.api.RenkeiClientException;
import com.dendo.renkei.protocol.config.RenkeiClientConfig;
import com.dendo.renkei.protocol.internal.decode.MotorDataDecoder;
import com.dendo.renkei.protocol.internal.decode.RenkeiDecodeException;
import com.dendo.renkei.protocol.internal.exec.RenkeiConnectionDriver;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiResponse;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.Slf4jRenkeiObservabilitySink;
import com.dendo.renkei.protocol.runtime.RenkeiClientRuntime;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * RenkeiMotorClient
 * =============================================================================
 * Production {@link MotorClient} for a RENKEI PoE motor.
 *
 * <pre>
 *   try (RenkeiMotorClient motor = RenkeiMotorClient.create(config)) {
 *       motor.connect().get();
 *       motor.move(50, 0).get();
 *   }
 * </pre>
 *
 * <p>Arguments are validated on the calling thread before anything is queued.
 * Every returned future is completed on the runtime's callback executor, never
 * on the I/O or driver thread, so continuations may block without stalling the
 * connection.</p>
 */
public final class RenkeiMotorClient implements MotorClient {

    private final RenkeiClientRuntime runtime;
    private final RenkeiConnectionDriver driver;
    private final Executor callbackExecutor;
    private final Duration commandTimeout;
    private final MotorDataDecoder dataDecoder = new MotorDataDecoder();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Wraps an already-built runtime. The caller decides when to start it.
     */
    public RenkeiMotorClient(RenkeiClientRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.driver = runtime.driver();
        this.callbackExecutor = runtime.callbackExecutor();
        this.commandTimeout = runtime.config().timingPolicy().commandTimeout();
    }

    /**
     * Builds and starts a client that logs through SLF4J.
     */
    public static RenkeiMotorClient create(RenkeiClientConfig config) {
        return create(config, new Slf4jRenkeiObservabilitySink());
    }

    public static RenkeiMotorClient create(RenkeiClientConfig config, RenkeiObservabilitySink observabilitySink) {
        RenkeiClientRuntime runtime = RenkeiClientRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(observabilitySink)
                .build();
        runtime.start();
        return new RenkeiMotorClient(runtime);
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> connect() {
        return relay(driver.connect(), Function.identity());
    }

    @Override
    public void disconnect() {
        driver.disconnect();
    }

    @Override
    public ConnectionState state() {
        return driver.state();
    }

    @Override
    public Optional<Instant> lastSeen() {
        return driver.lastSeen();
    }

    // ---------------------------------------------------------------------
    // Motor operations
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> move(int position, int delaySeconds) {
        return acknowledged(RenkeiCommand.move(position, delaySeconds));
    }

    @Override
    public CompletableFuture<Void> absoluteMove(int position, int delayMillis) {
        return acknowledged(RenkeiCommand.absoluteMove(position, delayMillis));
    }

    @Override
    public CompletableFuture<Void> stop() {
        return acknowledged(RenkeiCommand.stop());
    }

    @Override
    public CompletableFuture<Void> jog(int count) {
        return acknowledged(RenkeiCommand.jog(count));
    }

    @Override
    public CompletableFuture<MotorStatus> getStatus() {
        return send(RenkeiCommand.getStatus(), response -> dataDecoder.status(response.data()));
    }

    @Override
    public CompletableFuture<MotorInfo> getInfo() {
        return send(RenkeiCommand.getInfo(), response -> dataDecoder.info(response.data()));
    }

    // ---------------------------------------------------------------------
    // Listeners and lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void setStatusListener(MotorStatusListener listener) {
        runtime.notifier().setStatusListener(listener);
    }

    @Override
    public void setConnectionStateListener(ConnectionStateListener listener) {
        runtime.notifier().setConnectionStateListener(listener);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            runtime.stop();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> acknowledged(RenkeiCommand command) {
        return send(command, response -> null);
    }

    private <T> CompletableFuture<T> send(RenkeiCommand command, Function<RenkeiResponse, T> mapper) {
        return relay(driver.submitCommand(command, commandTimeout), response -> {
            try {
                return mapper.apply(response);
            } catch (RenkeiDecodeException e) {
                throw new RenkeiClientException("Malformed " + command.name().wireName() + " response", e);
            }
        });
    }

    /**
     * Moves completion of a driver-thread future onto the callback executor.
     */
    private <S, T> CompletableFuture<T> relay(CompletableFuture<S> source, Function<S, T> mapper) {
        CompletableFuture<T> result = new CompletableFuture<>();
        source.whenCompleteAsync((value, failure) -> {
            if (failure != null) {
                result.completeExceptionally(failure);
                return;
            }
            try {
                result.complete(mapper.apply(value));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, this::executeCallback);
        return result;
    }

    /**
     * Once the callback executor is gone, either through {@link #close()} or
     * because it was shut down underneath us, completions run inline.
     */
    private void executeCallback(Runnable task) {
        if (closed.get()) {
            task.run();
            return;
        }
        try {
            callbackExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }
}
