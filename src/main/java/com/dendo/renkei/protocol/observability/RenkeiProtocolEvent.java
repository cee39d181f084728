package com.dendo.renkei.protocol.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level occurrence.
 */
public record RenkeiProtocolEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        COMMAND_SENT,
        RESPONSE_RECEIVED,
        STATUS_UPDATE,
        COMMAND_TIMEOUT,
        DEVICE_ERROR,
        /** A response arrived with no matching pending command. */
        STRAY_RESPONSE,
        UNKNOWN_EVENT,
        DECODE_ERROR,
        HEALTH_PROBE_FAILED;

        /** Kinds that point at a misbehaving device or link rather than normal traffic. */
        public boolean isAnomaly() {
            return switch (this) {
                case COMMAND_TIMEOUT, DEVICE_ERROR, STRAY_RESPONSE, UNKNOWN_EVENT, DECODE_ERROR, HEALTH_PROBE_FAILED -> true;
                default -> false;
            };
        }
    }
}
