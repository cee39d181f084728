package com.dendo.renkei.protocol.internal.decode;

/**
 * An inbound line could not be decoded into a frame or its data could not be
 * interpreted.
 *
 * <p>Reported to observability and dropped by the transport adapter. Never
 * surfaced to callers and never fatal to the connection.</p>
 */
public final class RenkeiDecodeException extends RuntimeException
{
    public RenkeiDecodeException(String message) {
        super(message);
    }

    public RenkeiDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
