package com.dendo.renkei.api;

/**
 * The session ended while a command was awaiting its response.
 */
public final class ConnectionLostException extends RenkeiClientException
{
    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
