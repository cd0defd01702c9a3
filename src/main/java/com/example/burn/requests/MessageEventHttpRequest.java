package com.example.burn.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageEventHttpRequest(
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("guild_id") String guildId,
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("message_id") String messageId
) {

    public InboundMessage toInboundMessage() {
        return new InboundMessage(connectionId, userId, guildId, channelId, messageId);
    }
}
