package com.dendo.renkei.protocol.model;

import java.util.Optional;

/**
 * Commands understood by the motor controller, with their wire names.
 */
public enum CommandName
{
    /** Move to a percentage of travel. */
    MOVE("MOVE"),

    /** Move to a raw encoder position. */
    ABSOLUTE_MOVE("A_MOVE"),

    STOP("STOP"),

    GET_STATUS("GET_STATUS"),

    /** Network info; also used as the health probe. */
    GET_INFO("GET_INFO"),

    /** Physical identification wiggle. */
    JOG("JOG");

    private final String wireName;

    CommandName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CommandName> fromWireName(String wireName) {
        for (CommandName name : values()) {
            if (name.wireName.equals(wireName)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
