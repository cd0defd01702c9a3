package com.example.burn.platform;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Member role inside a group, ordered from least to most privileged.
 */
public enum GroupRole {
    MEMBER,
    ADMIN,
    OWNER;

    @JsonCreator
    public static GroupRole fromString(String v) {
        if (v == null) {
            throw new IllegalArgumentException("Unknown GroupRole: null");
        }
        for (GroupRole role : values()) {
            if (role.name().equals(v.toUpperCase(Locale.ROOT))) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown GroupRole: " + v);
    }
}
