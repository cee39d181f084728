package com.dendo.renkei.protocol.codec.impl;

import com.dendo.renkei.protocol.codec.RenkeiFrameEncoder;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed {@link RenkeiFrameEncoder}.
 *
 * <p>Output is compact JSON with {@code cmd} first and the parameters in the
 * order the command carries them, followed by a single {@code '\n'}.</p>
 */
public final class JacksonRenkeiFrameEncoder implements RenkeiFrameEncoder
{
    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper;

    public JacksonRenkeiFrameEncoder() {
        this(new ObjectMapper());
    }

    public JacksonRenkeiFrameEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(RenkeiCommand command) {
        Objects.requireNonNull(command, "command");

        ObjectNode root = mapper.createObjectNode();
        root.put("cmd", command.name().wireName());
        ObjectNode params = root.putObject("params");
        for (Map.Entry<String, Object> e : command.params().entrySet()) {
            params.set(e.getKey(), mapper.valueToTree(e.getValue()));
        }

        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            // Only primitives reach here, so this indicates a mapper misconfiguration.
            throw new UncheckedIOException("Failed to encode " + command.name().wireName(), e);
        }

        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = NEWLINE;
        return line;
    }
}
