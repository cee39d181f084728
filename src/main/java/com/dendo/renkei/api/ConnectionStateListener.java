package com.dendo.renkei.api;

/**
 * Receives every connection state transition, in the order the transitions occur.
 *
 * <p>Invoked on the client's callback thread, never on the network read loop.</p>
 */
@FunctionalInterface
public interface ConnectionStateListener
{
    void onConnectionState(ConnectionState state);
}
