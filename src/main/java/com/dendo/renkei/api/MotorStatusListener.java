package com.dendo.renkei.api;

/**
 * Receives motor status updates: unsolicited position and error pushes, and
 * full snapshots decoded from {@code GET_STATUS} responses.
 *
 * <p>Push updates are partial; fields the device did not report are empty.
 * Use {@link MotorStatus#mergedWith(MotorStatus)} to maintain a latest snapshot.</p>
 */
@FunctionalInterface
public interface MotorStatusListener
{
    void onStatus(MotorStatus status);
}
