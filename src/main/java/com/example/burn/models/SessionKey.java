package com.example.burn.models;

import java.util.Objects;

/**
 * Identity of a session within the scheduler registry and the message ledger.
 */
public record SessionKey(String userId, String guildId) {

    public SessionKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(guildId, "guildId");
    }

    /**
     * Partition value used by the captured message ledger. The user id is length-prefixed so that
     * ids containing {@code #} cannot collide, e.g. {@code ("1#2", "3")} and {@code ("1", "2#3")}.
     */
    public String ownerKey() {
        return userId.length() + ":" + userId + "#" + guildId;
    }

    @Override
    public String toString() {
        return userId + "@" + guildId;
    }
}
