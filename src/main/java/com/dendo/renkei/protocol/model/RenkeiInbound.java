package com.dendo.renkei.protocol.model;

import java.util.Map;

/**
 * A decoded inbound frame: either a response correlated to a command by name,
 * or an unsolicited push event.
 */
public sealed interface RenkeiInbound permits RenkeiResponse, RenkeiPushEvent
{
    /**
     * Discriminator: the command name for responses, the event type for pushes.
     */
    String name();

    /**
     * The frame's {@code data} object; empty when absent.
     */
    Map<String, Object> data();
}
