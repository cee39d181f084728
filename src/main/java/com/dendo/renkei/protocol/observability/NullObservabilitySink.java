package com.dendo.renkei.protocol.observability;

/**
 * No-op implementation of RenkeiObservabilitySink.
 */
public final class NullObservabilitySink implements RenkeiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onProtocolEvent(RenkeiProtocolEvent event) {}

    @Override
    public void onTransportEvent(RenkeiTransportEvent event) {}

    @Override
    public void onError(RenkeiErrorEvent event) {}
}
