package com.dendo.renkei.protocol.model;

import java.util.Optional;

/**
 * Error codes documented for the motor controller.
 *
 * <p>Used only to describe codes in logs and exception messages. Codes are
 * never rewritten; unknown codes pass through untouched.</p>
 */
public enum DeviceErrorCode
{
    UNKNOWN_COMMAND("100", "Unknown command"),
    INVALID_PARAMETERS("101", "Invalid parameters"),
    MOTOR_BUSY("102", "Motor busy"),
    MOTOR_UNREACHABLE("103", "Motor unreachable"),
    CHECKSUM_ERROR("104", "Checksum error"),

    LIMITS_NOT_SET("300", "Limits not set"),
    UART_ERROR("301", "UART Error"),
    VOLTAGE_ERROR("302", "Voltage error"),
    OVER_CURRENT("303", "Over-current error"),
    ENCODER_ERROR("304", "Encoder error");

    private final String code;
    private final String description;

    DeviceErrorCode(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    /**
     * Hardware-class codes (3xx) as opposed to command/parameter codes (1xx).
     */
    public boolean isHardwareFault() {
        return code.startsWith("3");
    }

    public static Optional<DeviceErrorCode> fromCode(String code) {
        for (DeviceErrorCode c : values()) {
            if (c.code.equals(code)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
