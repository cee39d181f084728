package com.dendo.renkei.api;

import java.util.Objects;

/**
 * The motor answered with an error.
 *
 * <p>The code is passed through exactly as the device sent it. Codes 100&ndash;104
 * are command/parameter errors and 300&ndash;304 hardware errors; other values may
 * appear with newer firmware and are not rejected.</p>
 */
public final class DeviceErrorException extends RenkeiClientException
{
    private final String code;
    private final String description;

    public DeviceErrorException(String code, String description) {
        super("Motor error " + code + ": " + description);
        this.code = Objects.requireNonNull(code, "code");
        this.description = Objects.requireNonNull(description, "description");
    }

    /**
     * Error code verbatim, e.g. {@code "302"}.
     */
    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
