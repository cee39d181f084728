package com.dendo.renkei.protocol.transport;

import com.dendo.renkei.protocol.codec.RenkeiFrameDecoder;
import com.dendo.renkei.protocol.internal.decode.RenkeiDecodeException;
import com.dendo.renkei.protocol.internal.events.ConnectionEvent;
import com.dendo.renkei.protocol.internal.events.FrameEvent;
import com.dendo.renkei.protocol.internal.events.RenkeiEvent;
import com.dendo.renkei.protocol.internal.time.WallClock;
import com.dendo.renkei.protocol.model.RenkeiInbound;
import com.dendo.renkei.protocol.observability.RenkeiObservabilitySink;
import com.dendo.renkei.protocol.observability.RenkeiProtocolEvent;
import com.dendo.renkei.protocol.observability.RenkeiTransportEvent;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * TcpTransportAdapter
 * =============================================================================
 * Translates {@link StreamEndpoint} callbacks into driver events.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   StreamEndpoint line
 *        → RenkeiFrameDecoder
 *            → FrameEvent
 *                → connection driver
 * </pre>
 *
 * <p>Lines that fail to decode are reported to the observability sink and
 * dropped; they never reach the driver and never close the connection. Blank
 * lines are ignored.</p>
 *
 * <p>This class adds no retries, timing or state. Whether an event still
 * matters is decided by the driver, using the generation each event carries.</p>
 */
public final class TcpTransportAdapter implements StreamEndpointListener
{
    private final RenkeiFrameDecoder decoder;
    private final Consumer<RenkeiEvent> eventSink;
    private final RenkeiObservabilitySink observabilitySink;
    private final WallClock wallClock;
    private final String remote;

    public TcpTransportAdapter(RenkeiFrameDecoder decoder,
                               Consumer<RenkeiEvent> eventSink,
                               RenkeiObservabilitySink observabilitySink,
                               WallClock wallClock,
                               String remote) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    @Override
    public void onTransportUp(long generation) {
        transportEvent(RenkeiTransportEvent.Kind.CONNECTED, generation, null);
        eventSink.accept(new ConnectionEvent.TransportUp(wallClock.now(), generation));
    }

    @Override
    public void onConnectFailed(long generation, Throwable cause) {
        transportEvent(RenkeiTransportEvent.Kind.CONNECT_FAILED, generation, cause);
        eventSink.accept(new ConnectionEvent.ConnectFailed(wallClock.now(), generation, cause));
    }

    @Override
    public void onTransportDown(long generation, Throwable cause) {
        transportEvent(RenkeiTransportEvent.Kind.DISCONNECTED, generation, cause);
        eventSink.accept(new ConnectionEvent.TransportDown(wallClock.now(), generation, cause));
    }

    @Override
    public void onLine(long generation, byte[] line) {
        Objects.requireNonNull(line, "line");
        if (isBlank(line)) {
            return;
        }

        final RenkeiInbound frame;
        try {
            frame = decoder.decode(line);
        } catch (RenkeiDecodeException e) {
            observabilitySink.onProtocolEvent(new RenkeiProtocolEvent(
                    wallClock.now(), RenkeiProtocolEvent.Kind.DECODE_ERROR, e.getMessage()));
            return;
        }

        eventSink.accept(new FrameEvent(wallClock.now(), generation, frame));
    }

    @Override
    public void onLineDiscarded(long generation, String reason) {
        observabilitySink.onProtocolEvent(new RenkeiProtocolEvent(
                wallClock.now(), RenkeiProtocolEvent.Kind.DECODE_ERROR, reason));
    }

    private void transportEvent(RenkeiTransportEvent.Kind kind, long generation, Throwable cause) {
        observabilitySink.onTransportEvent(new RenkeiTransportEvent(wallClock.now(), kind, remote, generation, cause));
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
