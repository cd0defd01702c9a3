package com.example.burn.requests;

/**
 * A message event observed on the platform. Direct messages carry no guild; events without a
 * message id cannot be recalled and are ignored by capture.
 */
public record InboundMessage(
        String connectionId,
        String userId,
        String guildId,
        String channelId,
        String messageId
) {
    public InboundMessage {
        ActivateSessionServiceRequest.requireNonBlank(userId, "userId");
        ActivateSessionServiceRequest.requireNonBlank(channelId, "channelId");
        guildId = (guildId == null || guildId.isBlank()) ? null : guildId;
        messageId = (messageId == null || messageId.isBlank()) ? null : messageId;
    }

    public boolean isRecallable() {
        return guildId != null && messageId != null;
    }
}
