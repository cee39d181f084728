package com.dendo.renkei.api;

/**
 * A caller-supplied parameter is outside the range the device accepts.
 * Thrown before any bytes are written.
 */
public final class MotorValidationException extends IllegalArgumentException
{
    private final String parameter;
    private final long value;

    public MotorValidationException(String parameter, long value, long min, long max) {
        super(parameter + " must be between " + min + " and " + max + " (was " + value + ")");
        this.parameter = parameter;
        this.value = value;
    }

    public String parameter() {
        return parameter;
    }

    public long value() {
        return value;
    }

    /**
     * Throws if {@code value} lies outside {@code [min, max]}.
     */
    public static void requireInRange(String parameter, long value, long min, long max) {
        if (value < min || value > max) {
            throw new MotorValidationException(parameter, value, min, max);
        }
    }
}
