package com.dendo.renkei.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the RENKEI client stack.
 */
public record RenkeiErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
