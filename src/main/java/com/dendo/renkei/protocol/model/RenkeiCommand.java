package com.dendo.renkei.protocol.model;

import com.dendo.renkei.api.MotorStatus;
import com.dendo.renkei.api.MotorValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RenkeiCommand
 * -----------------------------------------------------------------------------
 * One outbound request, {@code {"cmd": name, "params": {...}}} on the wire.
 *
 * <p>Instances are immutable. The factory methods enforce the parameter ranges
 * the firmware accepts and throw {@link MotorValidationException} otherwise, so
 * an out-of-range command can never reach the codec.</p>
 *
 * @param name            command name
 * @param params          parameters in wire order; values are numbers, strings or booleans
 * @param expectsResponse whether the device answers with a correlated response
 */
public record RenkeiCommand(CommandName name, Map<String, Object> params, boolean expectsResponse)
{
    public static final int MAX_PERCENT = 100;
    public static final int MAX_MOVE_DELAY_SECONDS = 30;
    public static final int MAX_ABSOLUTE_MOVE_DELAY_MILLIS = 10_000;
    public static final int MIN_JOG_COUNT = 1;
    public static final int MAX_JOG_COUNT = 10;

    public RenkeiCommand {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(params, "params");
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object v = e.getValue();
            if (!(v instanceof Number || v instanceof String || v instanceof Boolean)) {
                throw new IllegalArgumentException("param " + e.getKey() + " must be a primitive value");
            }
        }
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static RenkeiCommand move(int position, int delaySeconds) {
        MotorValidationException.requireInRange("position", position, 0, MAX_PERCENT);
        MotorValidationException.requireInRange("delay", delaySeconds, 0, MAX_MOVE_DELAY_SECONDS);
        return withPositionAndDelay(CommandName.MOVE, position, delaySeconds);
    }

    public static RenkeiCommand absoluteMove(int position, int delayMillis) {
        MotorValidationException.requireInRange("position", position, 0, MotorStatus.MAX_ENCODER_POSITION);
        MotorValidationException.requireInRange("delay", delayMillis, 0, MAX_ABSOLUTE_MOVE_DELAY_MILLIS);
        return withPositionAndDelay(CommandName.ABSOLUTE_MOVE, position, delayMillis);
    }

    public static RenkeiCommand stop() {
        return new RenkeiCommand(CommandName.STOP, Map.of(), true);
    }

    public static RenkeiCommand getStatus() {
        return new RenkeiCommand(CommandName.GET_STATUS, Map.of(), true);
    }

    public static RenkeiCommand getInfo() {
        return new RenkeiCommand(CommandName.GET_INFO, Map.of(), true);
    }

    public static RenkeiCommand jog(int count) {
        MotorValidationException.requireInRange("count", count, MIN_JOG_COUNT, MAX_JOG_COUNT);
        return new RenkeiCommand(CommandName.JOG, Map.of("count", count), true);
    }

    private static RenkeiCommand withPositionAndDelay(CommandName name, int position, int delay) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("pos", position);
        params.put("delay", delay);
        return new RenkeiCommand(name, params, true);
    }
}
