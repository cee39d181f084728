package com.dendo.renkei.protocol.transport;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a line-oriented stream transport (one TCP connection at a time).
 *
 * <p>The endpoint frames inbound bytes into lines and reports lifecycle changes;
 * it knows nothing of JSON, commands or the connection state machine. Every
 * callback carries the generation passed to {@link #connect(long)} so that
 * listeners can discard notifications from a connection they have already
 * given up on.</p>
 *
 * <p>Implementations may be backed by Netty or by a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives lines and lifecycle events.
     * Must be called before {@link #connect(long)}.
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Start an asynchronous connect. Exactly one of
     * {@link StreamEndpointListener#onTransportUp} or
     * {@link StreamEndpointListener#onConnectFailed} follows, tagged with {@code generation}.
     *
     * <p>Any connection still open is closed first.</p>
     */
    void connect(long generation);

    /**
     * Close the current connection, if any. Idempotent.
     */
    void close();

    /**
     * Write one complete line.
     *
     * @return {@code false} if no connection is open and nothing was written
     */
    boolean send(byte[] line);

    /**
     * Close and release every transport resource. The endpoint cannot be reused.
     */
    void shutdown();
}
