package com.dendo.renkei.protocol.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code {"response": name, "data": {...}}} for a command the client issues,
 * or the device's {@code ERROR} response.
 */
public record RenkeiResponse(String name, Map<String, Object> data) implements RenkeiInbound
{
    public static final String ERROR = "ERROR";

    public RenkeiResponse {
        Objects.requireNonNull(name, "name");
        data = Map.copyOf(Objects.requireNonNull(data, "data"));
    }

    public boolean isError() {
        return ERROR.equals(name);
    }

    public Optional<CommandName> command() {
        return CommandName.fromWireName(name);
    }
}
