package com.dendo.renkei.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RenkeiObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRenkeiObservabilitySink implements RenkeiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRenkeiObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("RENKEI connection: {} -> {} (generation {})",
                event.oldSnapshot().state(),
                event.newSnapshot().state(),
                event.newSnapshot().generation());
        } else if (log.isTraceEnabled()) {
            log.trace("RENKEI connection event ignored or internal: {}", event.triggeringEvent());
        }
    }

    @Override
    public void onProtocolEvent(RenkeiProtocolEvent event) {
        if (event.kind().isAnomaly()) {
            log.warn("RENKEI {}: {}", event.kind(), event.detail());
        } else {
            log.debug("RENKEI {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(RenkeiTransportEvent event) {
        if (event.cause() != null) {
            log.info("RENKEI transport {} {} (generation {}): {}",
                event.kind(), event.remote(), event.generation(), event.cause().toString());
        } else {
            log.info("RENKEI transport {} {} (generation {})",
                event.kind(), event.remote(), event.generation());
        }
    }

    @Override
    public void onError(RenkeiErrorEvent event) {
        log.error("RENKEI error: {}", event.message(), event.cause());
    }
}
