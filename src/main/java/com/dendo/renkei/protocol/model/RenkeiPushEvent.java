package com.dendo.renkei.protocol.model;

import java.util.Map;
import java.util.Objects;

/**
 * Unsolicited frame pushed by the motor, such as live position or an error notice.
 */
public record RenkeiPushEvent(String name, Map<String, Object> data) implements RenkeiInbound
{
    public static final String CURRENT_POS = "CURRENT_POS";
    public static final String ERROR = "ERROR";

    public RenkeiPushEvent {
        Objects.requireNonNull(name, "name");
        data = Map.copyOf(Objects.requireNonNull(data, "data"));
    }
}
