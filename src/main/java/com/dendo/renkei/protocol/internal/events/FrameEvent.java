package com.dendo.renkei.protocol.internal.events;

import com.dendo.renkei.protocol.model.RenkeiInbound;

import java.time.Instant;
import java.util.Objects;

/**
 * A decoded inbound frame, tagged with the connection generation it arrived on.
 */
public final class FrameEvent extends RenkeiEvent.Base
{
    private final long generation;
    private final RenkeiInbound frame;

    public FrameEvent(Instant timestamp, long generation, RenkeiInbound frame) {
        super(timestamp);
        this.generation = generation;
        this.frame = Objects.requireNonNull(frame, "frame");
    }

    public long generation() {
        return generation;
    }

    public RenkeiInbound frame() {
        return frame;
    }
}
