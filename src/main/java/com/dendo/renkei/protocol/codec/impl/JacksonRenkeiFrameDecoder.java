package com.dendo.renkei.protocol.codec.impl;

import com.dendo.renkei.protocol.codec.RenkeiFrameDecoder;
import com.dendo.renkei.protocol.internal.decode.RenkeiDecodeException;
import com.dendo.renkei.protocol.model.CommandName;
import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiInbound;
import com.dendo.renkei.protocol.model.RenkeiPushEvent;
import com.dendo.renkei.protocol.model.RenkeiResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson-backed {@link RenkeiFrameDecoder}.
 *
 * <p>Classification, in order:</p>
 * <ol>
 *   <li>{@code "event"} present: push event of that type</li>
 *   <li>{@code "response"} names a known command or {@code ERROR}: response</li>
 *   <li>{@code "response"} names anything else: push event</li>
 * </ol>
 *
 * <p>JSON {@code null} values inside {@code data} are dropped.</p>
 */
public final class JacksonRenkeiFrameDecoder implements RenkeiFrameDecoder
{
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int PREVIEW_LENGTH = 120;

    private final ObjectMapper mapper;

    public JacksonRenkeiFrameDecoder() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public JacksonRenkeiFrameDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public RenkeiInbound decode(byte[] line) {
        JsonNode root = readObject(line);
        Map<String, Object> data = readData(root, "data", line);

        JsonNode event = root.get("event");
        if (event != null) {
            return new RenkeiPushEvent(requireText(event, "event", line), data);
        }

        JsonNode response = root.get("response");
        if (response != null) {
            String name = requireText(response, "response", line);
            if (RenkeiResponse.ERROR.equals(name) || CommandName.fromWireName(name).isPresent()) {
                return new RenkeiResponse(name, data);
            }
            return new RenkeiPushEvent(name, data);
        }

        throw new RenkeiDecodeException("Frame has neither 'response' nor 'event': " + preview(line));
    }

    @Override
    public RenkeiCommand decodeCommand(byte[] line) {
        JsonNode root = readObject(line);

        JsonNode cmd = root.get("cmd");
        if (cmd == null) {
            throw new RenkeiDecodeException("Request has no 'cmd': " + preview(line));
        }
        String wireName = requireText(cmd, "cmd", line);
        CommandName name = CommandName.fromWireName(wireName)
                .orElseThrow(() -> new RenkeiDecodeException("Unknown command " + wireName));

        try {
            return new RenkeiCommand(name, readData(root, "params", line), true);
        } catch (IllegalArgumentException e) {
            throw new RenkeiDecodeException("Malformed params for " + wireName, e);
        }
    }

    private JsonNode readObject(byte[] line) {
        Objects.requireNonNull(line, "line");

        final JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (IOException e) {
            throw new RenkeiDecodeException("Invalid JSON: " + preview(line), e);
        }
        if (root == null || !root.isObject()) {
            throw new RenkeiDecodeException("Frame is not a JSON object: " + preview(line));
        }
        return root;
    }

    private Map<String, Object> readData(JsonNode root, String field, byte[] line) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new RenkeiDecodeException("'" + field + "' is not an object: " + preview(line));
        }

        LinkedHashMap<String, Object> values = mapper.convertValue(node, MAP_TYPE);
        values.values().removeIf(Objects::isNull);
        return values;
    }

    private static String requireText(JsonNode node, String field, byte[] line) {
        if (!node.isTextual()) {
            throw new RenkeiDecodeException("'" + field + "' is not a string: " + preview(line));
        }
        return node.asText();
    }

    static String preview(byte[] line) {
        String text = new String(line, StandardCharsets.UTF_8);
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
