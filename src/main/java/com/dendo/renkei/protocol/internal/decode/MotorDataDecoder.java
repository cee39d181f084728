package com.dendo.renkei.protocol.internal.decode;

import com.dendo.renkei.api.MotorInfo;
import com.dendo.renkei.api.MotorStatus;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * MotorDataDecoder
 * =============================================================================
 * Translates the untyped {@code data} objects of decoded frames into
 * {@link MotorStatus} and {@link MotorInfo}.
 *
 * <h2>Field tolerance</h2>
 * <ul>
 *   <li>Integers may arrive as JSON numbers or decimal strings. Fractional or
 *       out-of-range numbers are rejected.</li>
 *   <li>{@code CURRENT_POS.absolute} is a hexadecimal string on current firmware;
 *       a plain number is also accepted.</li>
 *   <li>Missing fields leave the snapshot field empty.</li>
 * </ul>
 */
public final class MotorDataDecoder
{
    /**
     * Full or partial status from a {@code GET_STATUS} response.
     */
    public MotorStatus status(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        return new MotorStatus(
                intField(data, "current_pos"),
                intField(data, "limit_pos"),
                intField(data, "target_pos"),
                intField(data, "run_flags"),
                intField(data, "err_flags"),
                OptionalInt.empty());
    }

    /**
     * Partial status from a {@code CURRENT_POS} push.
     */
    public MotorStatus currentPosition(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");

        OptionalInt current = intField(data, "current_pos");
        if (current.isEmpty() && data.containsKey("absolute")) {
            current = hexOrIntField(data, "absolute");
        }
        return new MotorStatus(
                current,
                OptionalInt.empty(),
                OptionalInt.empty(),
                OptionalInt.empty(),
                OptionalInt.empty(),
                intField(data, "percent"));
    }

    /**
     * Partial status from an {@code ERROR} push: the device code lands in {@code err_flags}.
     */
    public MotorStatus errorNotice(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        OptionalInt code = intField(data, "code");
        if (code.isEmpty()) {
            code = intField(data, "err_flags");
        }
        return code.isPresent() ? MotorStatus.empty().withErrFlags(code.getAsInt()) : MotorStatus.empty();
    }

    public MotorInfo info(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        return new MotorInfo(
                stringField(data, "ip"),
                stringField(data, "mac"),
                stringField(data, "firmware"));
    }

    /**
     * Error code as the device sent it, rendered as text.
     */
    public String errorCode(Map<String, Object> data) {
        Object code = data.get("code");
        return code == null ? "unknown" : code.toString();
    }

    public String errorDescription(Map<String, Object> data) {
        Object description = data.get("description");
        return description == null ? "No description" : description.toString();
    }

    private static OptionalInt intField(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return OptionalInt.empty();
        }
        if (value instanceof Number n) {
            return OptionalInt.of(exactInt(key, n));
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw new RenkeiDecodeException("Field '" + key + "' is not an integer: " + value, e);
        }
    }

    private static OptionalInt hexOrIntField(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Number n) {
            return OptionalInt.of(exactInt(key, n));
        }
        String text = value.toString().trim();
        if (text.startsWith("0x") || text.startsWith("0X")) {
            text = text.substring(2);
        }
        try {
            return OptionalInt.of(Integer.parseInt(text, 16));
        } catch (NumberFormatException e) {
            throw new RenkeiDecodeException("Field '" + key + "' is not hexadecimal: " + value, e);
        }
    }

    private static int exactInt(String key, Number n) {
        try {
            return new BigDecimal(n.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new RenkeiDecodeException("Field '" + key + "' is not an integer: " + n, e);
        }
    }

    private static String stringField(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value == null ? "" : value.toString();
    }
}
