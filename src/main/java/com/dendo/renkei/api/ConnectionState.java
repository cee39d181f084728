package com.dendo.renkei.api;

/**
 * Lifecycle state of the single TCP session a client holds to its motor.
 *
 * <p>Exactly one value holds at any instant. Commands are only written while
 * the client is {@link #CONNECTED}.</p>
 */
public enum ConnectionState
{
    /** No session and no reconnection pending. Left only by an explicit connect. */
    DISCONNECTED,

    /** A TCP connect is in progress, or the socket is up but still stabilising. */
    CONNECTING,

    /** Session established and stabilised; commands may be issued. */
    CONNECTED,

    /** The session was lost; a new attempt is scheduled after the reconnect interval. */
    RECONNECTING
}
