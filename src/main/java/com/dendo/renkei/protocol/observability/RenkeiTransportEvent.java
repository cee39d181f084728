package com.dendo.renkei.protocol.observability;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a TCP socket lifecycle event.
 */
public record RenkeiTransportEvent(
    Instant timestamp,
    Kind kind,
    String remote,
    long generation,
    Throwable cause
) {
    public enum Kind {
        CONNECTING,
        CONNECTED,
        CONNECT_FAILED,
        DISCONNECTED
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(cause);
    }
}
