package com.dendo.renkei.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * RenkeiEvent
 * -----------------------------------------------------------------------------
 * Marker for everything processed by the connection driver's event loop.
 *
 * <p>Events are the only way work reaches the driver: caller commands, decoded
 * frames, transport lifecycle changes and timer expiries all arrive as events and
 * are processed one at a time on the driver thread. Events are immutable.</p>
 */
public interface RenkeiEvent
{
    /**
     * Wall-clock time the event was created. Observability only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements RenkeiEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
