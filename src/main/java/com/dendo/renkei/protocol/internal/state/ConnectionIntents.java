package com.dendo.renkei.protocol.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ConnectionIntents
 * -----------------------------------------------------------------------------
 * Side effects requested by {@link ConnectionReducer}.
 *
 * <p>The reducer decides <b>what</b> must happen on a transition; the driver and
 * its intent executor decide <b>how</b>. Intents never perform I/O themselves.</p>
 */
public final class ConnectionIntents
{
    /**
     * Kinds of action a transition may require. Declaration order is the order
     * in which they are carried out.
     */
    public enum Kind {
        /** Fail every pending command with a connection-lost error. */
        ABANDON_PENDING,

        STOP_HEALTH_MONITOR,

        /** Cancel the stabilisation and reconnect timers. */
        CANCEL_TIMERS,

        CLOSE_TRANSPORT,

        /** Start a TCP connect for the snapshot's generation. */
        OPEN_TRANSPORT,

        /** Arm the stabilisation delay for the snapshot's generation. */
        ARM_STABILISATION,

        /** Arm the reconnect interval for the snapshot's generation. */
        ARM_RECONNECT,

        START_HEALTH_MONITOR,

        /** Issue a GET_STATUS so listeners resynchronise after a reconnection. */
        REFRESH_STATUS
    }

    private static final ConnectionIntents NONE = new ConnectionIntents(EnumSet.noneOf(Kind.class), null);

    private final Set<Kind> kinds;
    private final Throwable cause;

    private ConnectionIntents(Set<Kind> kinds, Throwable cause) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.cause = cause;
    }

    public static ConnectionIntents none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * What caused the connection to be lost, if the transition was a failure.
     */
    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "ConnectionIntents" + kinds;
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private Throwable cause;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public ConnectionIntents build() {
            return new ConnectionIntents(kinds, cause);
        }
    }
}
