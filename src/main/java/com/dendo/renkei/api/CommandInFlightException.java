package com.dendo.renkei.api;

/**
 * A command of the same name is already awaiting its response.
 *
 * <p>The protocol correlates responses by command name only, so two
 * outstanding commands with the same name cannot be told apart.</p>
 */
public final class CommandInFlightException extends RenkeiClientException
{
    private final String command;

    public CommandInFlightException(String command) {
        super("A " + command + " command is already awaiting a response");
        this.command = command;
    }

    public String command() {
        return command;
    }
}
