package com.dendo.renkei.protocol.internal.time;

/**
 * Handle for a task armed on a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Prevents the task from running if it has not run yet.
     *
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         already ran or was already cancelled
     */
    boolean cancel();
}
