package com.example.burn.requests;

/**
 * Service-layer command for turning burn-after-reading off in the current group.
 */
public record DeactivateSessionServiceRequest(
        String connectionId,
        String userId,
        String guildId,
        String channelId
) {
    public DeactivateSessionServiceRequest {
        ActivateSessionServiceRequest.requireNonBlank(connectionId, "connectionId");
        ActivateSessionServiceRequest.requireNonBlank(userId, "userId");
        ActivateSessionServiceRequest.requireNonBlank(channelId, "channelId");
        guildId = (guildId == null || guildId.isBlank()) ? null : guildId;
    }
}
