package com.dendo.renkei.api;

/**
 * A command was issued while the client was not {@link ConnectionState#CONNECTED}.
 */
public final class NotConnectedException extends RenkeiClientException
{
    private final ConnectionState state;

    public NotConnectedException(ConnectionState state, String message) {
        super(message);
        this.state = state;
    }

    /**
     * The state the client was in when the command was rejected.
     */
    public ConnectionState state() {
        return state;
    }
}
