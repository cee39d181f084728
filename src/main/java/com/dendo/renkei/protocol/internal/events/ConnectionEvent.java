package com.dendo.renkei.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * ConnectionEvent
 * -----------------------------------------------------------------------------
 * Inputs to the connection state machine.
 *
 * <p>Events raised by the transport or by timers carry the <em>generation</em> of
 * the connection attempt they belong to. Each connect attempt gets a new
 * generation, so a late close notification from a socket that has already been
 * replaced can be recognised and ignored.</p>
 */
public sealed interface ConnectionEvent extends RenkeiEvent
        permits ConnectionEvent.ConnectRequested,
                ConnectionEvent.DisconnectRequested,
                ConnectionEvent.Generational
{
    /**
     * Caller asked to connect. {@code whenConnected} completes the next time the
     * connection reaches {@code CONNECTED}, or fails if it is disconnected first.
     */
    final class ConnectRequested extends RenkeiEvent.Base implements ConnectionEvent {
        private final CompletableFuture<Void> whenConnected;

        public ConnectRequested(Instant timestamp, CompletableFuture<Void> whenConnected) {
            super(timestamp);
            this.whenConnected = Objects.requireNonNull(whenConnected, "whenConnected");
        }

        public CompletableFuture<Void> whenConnected() {
            return whenConnected;
        }
    }

    /** Caller asked to disconnect. */
    final class DisconnectRequested extends RenkeiEvent.Base implements ConnectionEvent {
        public DisconnectRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Base for events tied to one connection attempt. */
    abstract sealed class Generational extends RenkeiEvent.Base implements ConnectionEvent
            permits TransportUp, ConnectFailed, TransportDown, StabilisationElapsed, HealthCheckFailed, ReconnectDue
    {
        private final long generation;

        protected Generational(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        public long generation() {
            return generation;
        }
    }

    /** TCP socket established. */
    final class TransportUp extends Generational {
        public TransportUp(Instant timestamp, long generation) {
            super(timestamp, generation);
        }
    }

    /** TCP connect attempt failed (timeout, refused, unresolvable host). */
    final class ConnectFailed extends Generational {
        private final Throwable cause;

        public ConnectFailed(Instant timestamp, long generation, Throwable cause) {
            super(timestamp, generation);
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public Throwable cause() {
            return cause;
        }
    }

    /** Established socket closed: EOF, reset, or I/O error. */
    final class TransportDown extends Generational {
        private final Throwable cause;

        public TransportDown(Instant timestamp, long generation, Throwable cause) {
            super(timestamp, generation);
            this.cause = cause;
        }

        /**
         * Failure that closed the socket; empty for an orderly close by the peer.
         */
        public Optional<Throwable> cause() {
            return Optional.ofNullable(cause);
        }
    }

    /** The post-connect settling delay has passed. */
    final class StabilisationElapsed extends Generational {
        public StabilisationElapsed(Instant timestamp, long generation) {
            super(timestamp, generation);
        }
    }

    /** A liveness probe timed out or was answered with an error. */
    final class HealthCheckFailed extends Generational {
        private final Throwable cause;

        public HealthCheckFailed(Instant timestamp, long generation, Throwable cause) {
            super(timestamp, generation);
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public Throwable cause() {
            return cause;
        }
    }

    /** The reconnect interval has passed. */
    final class ReconnectDue extends Generational {
        public ReconnectDue(Instant timestamp, long generation) {
            super(timestamp, generation);
        }
    }
}
