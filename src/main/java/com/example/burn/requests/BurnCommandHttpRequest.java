package com.example.burn.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HTTP-layer payload shared by the enable and disable commands. {@code message_id} is only read
 * by enable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BurnCommandHttpRequest(
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("guild_id") String guildId,
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("message_id") String messageId
) {

    public ActivateSessionServiceRequest toActivateRequest() {
        return new ActivateSessionServiceRequest(connectionId, userId, guildId, channelId, messageId);
    }

    public DeactivateSessionServiceRequest toDeactivateRequest() {
        return new DeactivateSessionServiceRequest(connectionId, userId, guildId, channelId);
    }
}
