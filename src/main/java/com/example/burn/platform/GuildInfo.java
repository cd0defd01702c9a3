package com.example.burn.platform;

import java.util.Objects;

public record GuildInfo(String guildId, String name) {

    public GuildInfo {
        Objects.requireNonNull(guildId, "guildId");
    }

    /**
     * Human-readable label, {@code name（id）} when the name is known, otherwise the bare id.
     */
    public String displayName() {
        return (name == null || name.isBlank()) ? guildId : name + "（" + guildId + "）";
    }
}
