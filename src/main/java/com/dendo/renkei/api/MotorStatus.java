package com.dendo.renkei.api;

import java.util.OptionalInt;

/**
 * Immutable snapshot of motor status.
 *
 * <p>Positions are raw encoder units (0&ndash;65536). {@code currentPercent} is
 * only reported by {@code CURRENT_POS} pushes. A field is empty when the frame
 * it was decoded from did not carry it.</p>
 *
 * @param currentPos     current encoder position
 * @param limitPos       configured travel limit
 * @param targetPos      position the motor is moving towards
 * @param runFlags       run-state bitfield
 * @param errFlags       error bitfield or device error code
 * @param currentPercent current position as a percentage of travel
 */
public record MotorStatus(
        OptionalInt currentPos,
        OptionalInt limitPos,
        OptionalInt targetPos,
        OptionalInt runFlags,
        OptionalInt errFlags,
        OptionalInt currentPercent
) {
    public static final int MAX_ENCODER_POSITION = 65536;

    private static final MotorStatus EMPTY = new MotorStatus(
            OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(),
            OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty());

    public MotorStatus {
        currentPos = orEmpty(currentPos);
        limitPos = orEmpty(limitPos);
        targetPos = orEmpty(targetPos);
        runFlags = orEmpty(runFlags);
        errFlags = orEmpty(errFlags);
        currentPercent = orEmpty(currentPercent);
    }

    public static MotorStatus empty() {
        return EMPTY;
    }

    /**
     * Full snapshot as returned by {@code GET_STATUS}.
     */
    public static MotorStatus of(int currentPos, int limitPos, int targetPos, int runFlags, int errFlags) {
        return new MotorStatus(
                OptionalInt.of(currentPos),
                OptionalInt.of(limitPos),
                OptionalInt.of(targetPos),
                OptionalInt.of(runFlags),
                OptionalInt.of(errFlags),
                OptionalInt.empty());
    }

    public MotorStatus withCurrentPos(int value) {
        return new MotorStatus(OptionalInt.of(value), limitPos, targetPos, runFlags, errFlags, currentPercent);
    }

    public MotorStatus withLimitPos(int value) {
        return new MotorStatus(currentPos, OptionalInt.of(value), targetPos, runFlags, errFlags, currentPercent);
    }

    public MotorStatus withTargetPos(int value) {
        return new MotorStatus(currentPos, limitPos, OptionalInt.of(value), runFlags, errFlags, currentPercent);
    }

    public MotorStatus withRunFlags(int value) {
        return new MotorStatus(currentPos, limitPos, targetPos, OptionalInt.of(value), errFlags, currentPercent);
    }

    public MotorStatus withErrFlags(int value) {
        return new MotorStatus(currentPos, limitPos, targetPos, runFlags, OptionalInt.of(value), currentPercent);
    }

    public MotorStatus withCurrentPercent(int value) {
        return new MotorStatus(currentPos, limitPos, targetPos, runFlags, errFlags, OptionalInt.of(value));
    }

    public MotorStatus withoutCurrentPercent() {
        return new MotorStatus(currentPos, limitPos, targetPos, runFlags, errFlags, OptionalInt.empty());
    }

    /**
     * Returns a snapshot where every field present in {@code update} replaces
     * the corresponding field of this snapshot.
     */
    public MotorStatus mergedWith(MotorStatus update) {
        return new MotorStatus(
                prefer(update.currentPos, currentPos),
                prefer(update.limitPos, limitPos),
                prefer(update.targetPos, targetPos),
                prefer(update.runFlags, runFlags),
                prefer(update.errFlags, errFlags),
                prefer(update.currentPercent, currentPercent));
    }

    /**
     * True when the device reported any error bit.
     */
    public boolean hasError() {
        return errFlags.isPresent() && errFlags.getAsInt() != 0;
    }

    private static OptionalInt prefer(OptionalInt first, OptionalInt fallback) {
        return first.isPresent() ? first : fallback;
    }

    private static OptionalInt orEmpty(OptionalInt value) {
        return value == null ? OptionalInt.empty() : value;
    }
}
