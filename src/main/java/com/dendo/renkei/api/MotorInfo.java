package com.dendo.renkei.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Network identity and firmware of a motor, as returned by {@code GET_INFO}.
 *
 * @param ip       the address the motor reports for itself
 * @param mac      MAC address, in whatever separator style the firmware uses
 * @param firmware firmware version string
 */
public record MotorInfo(String ip, String mac, String firmware)
{
    public MotorInfo {
        ip = Objects.requireNonNullElse(ip, "");
        mac = Objects.requireNonNullElse(mac, "");
        firmware = Objects.requireNonNullElse(firmware, "");
    }

    /**
     * MAC address with separators removed, lower case.
     */
    public String normalizedMac() {
        return mac.replace(":", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Device name built from the last three MAC bytes, e.g. {@code RENKEI PoE DDEEFF}.
     */
    public String deviceName() {
        String clean = normalizedMac().toUpperCase(Locale.ROOT);
        String suffix = clean.length() >= 6 ? clean.substring(clean.length() - 6) : clean;
        return "RENKEI PoE " + suffix;
    }
}
