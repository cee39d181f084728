package com.dendo.renkei.api;

/**
 * Base type for failures delivered to callers of {@link MotorClient} operations.
 *
 * <p>These are reported by completing the operation's future exceptionally.
 * Argument validation failures are reported separately and synchronously via
 * {@link MotorValidationException}.</p>
 */
public class RenkeiClientException extends RuntimeException
{
    public RenkeiClientException(String message) {
        super(message);
    }

    public RenkeiClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
