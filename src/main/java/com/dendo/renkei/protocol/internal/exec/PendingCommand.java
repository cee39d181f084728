package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.protocol.model.RenkeiResponse;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * One command awaiting its correlated response.
 *
 * @param name          wire name the response will carry
 * @param timeout       deadline relative to registration, kept for error messages
 * @param deadlineNanos absolute monotonic deadline
 * @param result        completed with the response, or exceptionally
 */
public record PendingCommand(
        String name,
        Duration timeout,
        long deadlineNanos,
        CompletableFuture<RenkeiResponse> result
) {
    boolean isExpired(long nowNanos) {
        return nowNanos - deadlineNanos >= 0;
    }
}
