package com.dendo.renkei.protocol.internal.events;

import com.dendo.renkei.protocol.model.RenkeiCommand;
import com.dendo.renkei.protocol.model.RenkeiResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * CommandEvent
 * -----------------------------------------------------------------------------
 * Command traffic handled by the driver outside the connection reducer.
 */
public sealed interface CommandEvent extends RenkeiEvent
        permits CommandEvent.CommandRequested, CommandEvent.TimeoutSweepDue
{
    /**
     * A command to write. {@code result} completes with the correlated response,
     * or with {@code null} for commands that expect none.
     */
    final class CommandRequested extends RenkeiEvent.Base implements CommandEvent {
        private final RenkeiCommand command;
        private final Duration timeout;
        private final CompletableFuture<RenkeiResponse> result;

        public CommandRequested(Instant timestamp,
                                RenkeiCommand command,
                                Duration timeout,
                                CompletableFuture<RenkeiResponse> result) {
            super(timestamp);
            this.command = Objects.requireNonNull(command, "command");
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            this.result = Objects.requireNonNull(result, "result");
        }

        public RenkeiCommand command() {
            return command;
        }

        public Duration timeout() {
            return timeout;
        }

        public CompletableFuture<RenkeiResponse> result() {
            return result;
        }
    }

    /** A pending-command deadline has been reached. */
    final class TimeoutSweepDue extends RenkeiEvent.Base implements CommandEvent {
        public TimeoutSweepDue(Instant timestamp) {
            super(timestamp);
        }
    }
}
