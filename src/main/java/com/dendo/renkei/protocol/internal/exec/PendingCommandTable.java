package com.dendo.renkei.protocol.internal.exec;

import com.dendo.renkei.api.CommandInFlightException;
import com.dendo.renkei.api.CommandTimeoutException;
import com.dendo.renkei.protocol.internal.time.MonotonicClock;
import com.dendo.renkei.protocol.model.RenkeiResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * PendingCommandTable
 * =============================================================================
 * Commands awaiting a response, keyed by command name.
 *
 * <h2>Correlation</h2>
 * The protocol carries no request id: a response is matched to its request by
 * command name alone. At most one command per name may therefore be pending;
 * {@link #register} rejects a second one with {@link CommandInFlightException}.
 * Commands with different names may be pending at the same time.
 *
 * <h2>Ordering</h2>
 * Entries keep registration order. Device {@code ERROR} responses name no
 * command and are charged to the oldest entry ({@link #failOldest}).
 *
 * <h2>Threading</h2>
 * Not thread-safe. Confined to the connection driver's event-loop thread.
 */
public final class PendingCommandTable
{
    private final MonotonicClock clock;
    private final Map<String, PendingCommand> pending = new LinkedHashMap<>();

    public PendingCommandTable(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a waiter for {@code name} with a fresh future.
     *
     * @throws CommandInFlightException if a command of that name is already pending
     */
    public PendingCommand register(String name, Duration timeout) {
        return register(name, timeout, new CompletableFuture<>());
    }

    /**
     * Registers {@code result} as the waiter for {@code name}.
     *
     * @throws CommandInFlightException if a command of that name is already pending
     */
    public PendingCommand register(String name, Duration timeout, CompletableFuture<RenkeiResponse> result) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(result, "result");

        if (pending.containsKey(name)) {
            throw new CommandInFlightException(name);
        }
        PendingCommand command = new PendingCommand(name, timeout, clock.nowNanos() + timeout.toNanos(), result);
        pending.put(name, command);
        return command;
    }

    /**
     * Completes the waiter whose name matches the response.
     *
     * @return {@code false} if nothing was waiting for it (a stray response)
     */
    public boolean resolve(RenkeiResponse response) {
        Objects.requireNonNull(response, "response");
        PendingCommand command = pending.remove(response.name());
        if (command == null) {
            return false;
        }
        command.result().complete(response);
        return true;
    }

    /**
     * Fails the longest-waiting command.
     *
     * @return the failed command's name, or {@code null} if nothing was pending
     */
    public String failOldest(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        Iterator<PendingCommand> it = pending.values().iterator();
        if (!it.hasNext()) {
            return null;
        }
        PendingCommand oldest = it.next();
        it.remove();
        oldest.result().completeExceptionally(cause);
        return oldest.name();
    }

    /**
     * Fails the waiter for {@code name}, if any.
     *
     * @return {@code false} if nothing of that name was pending
     */
    public boolean fail(String name, Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        PendingCommand command = pending.remove(name);
        if (command == null) {
            return false;
        }
        command.result().completeExceptionally(cause);
        return true;
    }

    /**
     * Fails every command whose deadline has passed with {@link CommandTimeoutException}.
     *
     * @return names of the commands that timed out, oldest first
     */
    public List<String> timeoutSweep(long nowNanos) {
        List<String> expired = new ArrayList<>();
        Iterator<PendingCommand> it = pending.values().iterator();
        while (it.hasNext()) {
            PendingCommand command = it.next();
            if (command.isExpired(nowNanos)) {
                it.remove();
                expired.add(command.name());
                command.result().completeExceptionally(new CommandTimeoutException(command.name(), command.timeout()));
            }
        }
        return expired;
    }

    /**
     * Fails every pending command with {@code cause} and empties the table.
     *
     * @return how many commands were abandoned
     */
    public int abandonAll(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        List<PendingCommand> all = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingCommand command : all) {
            command.result().completeExceptionally(cause);
        }
        return all.size();
    }

    /**
     * Earliest deadline among pending commands.
     */
    public OptionalLong nextDeadline() {
        return pending.values().stream().mapToLong(PendingCommand::deadlineNanos).min();
    }

    public boolean isPending(String name) {
        return pending.containsKey(name);
    }

    public int size() {
        return pending.size();
    }
}
