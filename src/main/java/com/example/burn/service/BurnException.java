package com.example.burn.service;

import lombok.Getter;

/**
 * A rejected enable/disable command. Thrown before any state change.
 */
public class BurnException extends RuntimeException {

    public enum Code {
        NOT_IN_GROUP,
        UNKNOWN_CONNECTION,
        BOT_NOT_PRIVILEGED,
        USER_OUTRANKS_BOT,
        ALREADY_ACTIVE,
        ACTIVE_IN_OTHER_GROUP,
        GROUP_FULL,
        NOT_ACTIVE,
        NOT_ACTIVE_HERE
    }

    @Getter
    private final Code code;

    private BurnException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static BurnException notInGroup() {
        return new BurnException(Code.NOT_IN_GROUP,
                "This command can only be used in a group");
    }

    public static BurnException unknownConnection(String connectionId) {
        return new BurnException(Code.UNKNOWN_CONNECTION,
                "Platform connection " + connectionId + " is not configured");
    }

    public static BurnException botNotPrivileged() {
        return new BurnException(Code.BOT_NOT_PRIVILEGED,
                "The bot is not a group admin and cannot recall messages");
    }

    public static BurnException userOutranksBot() {
        return new BurnException(Code.USER_OUTRANKS_BOT,
                "Your group role is equal to or above the bot's, so it cannot recall your messages");
    }

    public static BurnException alreadyActive() {
        return new BurnException(Code.ALREADY_ACTIVE,
                "Burn after reading is already on in this group");
    }

    public static BurnException activeInOtherGroup(String guildDisplayName) {
        return new BurnException(Code.ACTIVE_IN_OTHER_GROUP,
                "Burn after reading is already on in group " + guildDisplayName
                        + ". It can only be on in one group at a time; turn it off there first");
    }

    public static BurnException groupFull(int maxUsers) {
        return new BurnException(Code.GROUP_FULL,
                "This group already has the maximum of " + maxUsers + " users with burn after reading on");
    }

    public static BurnException notActive() {
        return new BurnException(Code.NOT_ACTIVE,
                "Burn after reading is not on in this group");
    }

    public static BurnException notActiveHere(String guildDisplayName) {
        return new BurnException(Code.NOT_ACTIVE_HERE,
                "Burn after reading is not on in this group. It is on in group " + guildDisplayName
                        + "; turn it off there");
    }
}
