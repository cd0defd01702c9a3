package com.example.burn.requests;

import java.util.Objects;

/**
 * Service-layer command for enabling burn-after-reading. {@code guildId} is null when the command
 * was issued outside a group; {@code messageId} is the command message itself and is recalled
 * with the rest of the session when present.
 */
public record ActivateSessionServiceRequest(
        String connectionId,
        String userId,
        String guildId,
        String channelId,
        String messageId
) {
    public ActivateSessionServiceRequest {
        requireNonBlank(connectionId, "connectionId");
        requireNonBlank(userId, "userId");
        requireNonBlank(channelId, "channelId");
        guildId = (guildId == null || guildId.isBlank()) ? null : guildId;
        messageId = (messageId == null || messageId.isBlank()) ? null : messageId;
    }

    static void requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must be non-blank");
        }
    }
}
