package com.dendo.renkei.protocol.observability;

/**
 * Receives observability events from the RENKEI client stack.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Calls arrive on the client's event-loop thread and must not block.</p>
 */
public interface RenkeiObservabilitySink {
    /**
     * Called for every reduction of a connection event, whether or not the state changed.
     * @param event the transition details
     */
    void onStateTransition(ConnectionTransitionEvent event);

    /**
     * Called for protocol-level occurrences (command sent, timeout, stray response, decode error).
     * @param event the protocol event
     */
    void onProtocolEvent(RenkeiProtocolEvent event);

    /**
     * Called when the TCP socket is opened, fails or closes.
     * @param event the transport event
     */
    void onTransportEvent(RenkeiTransportEvent event);

    /**
     * Called when an error or anomaly occurs that no caller will see.
     * @param event the error event
     */
    void onError(RenkeiErrorEvent event);
}
