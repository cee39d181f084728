package com.dendo.renkei.api;

import java.time.Duration;

/**
 * No correlated response arrived within the command's deadline.
 */
public final class CommandTimeoutException extends RenkeiClientException
{
    private final String command;

    public CommandTimeoutException(String command, Duration timeout) {
        super("Timeout waiting for response to " + command + " after " + timeout.toMillis() + "ms");
        this.command = command;
    }

    public String command() {
        return command;
    }
}
