package com.dendo.renkei.protocol.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks for one connection are delivered serially, in order. They run on
 * the transport's I/O thread and must not block.</p>
 */
public interface StreamEndpointListener
{
    /** The socket is established. */
    void onTransportUp(long generation);

    /** The connect attempt failed (timeout, refused, unresolvable host). */
    void onConnectFailed(long generation, Throwable cause);

    /**
     * An established connection closed.
     *
     * @param cause I/O failure that closed it; {@code null} for an orderly close
     */
    void onTransportDown(long generation, Throwable cause);

    /**
     * One inbound line, without its terminating newline.
     */
    void onLine(long generation, byte[] line);

    /**
     * An inbound line exceeded the maximum length and was discarded. The stream
     * resynchronises at the next newline.
     */
    void onLineDiscarded(long generation, String reason);
}
