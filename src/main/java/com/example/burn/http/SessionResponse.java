package com.example.burn.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        @JsonProperty("status") String status,
        @JsonProperty("user_id") String userId,
        @JsonProperty("guild_id") String guildId,
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("enabled_at") Long enabledAt,
        @JsonProperty("expires_at") Long expiresAt,
        @JsonProperty("recall_delay_seconds") Long recallDelaySeconds,
        @JsonProperty("max_duration_seconds") Long maxDurationSeconds,
        @JsonProperty("timer_cancelled") Boolean timerCancelled
) {
    public SessionResponse {
        if (expiresAt != null && enabledAt != null && expiresAt < enabledAt) {
            throw new IllegalArgumentException("expiresAt must not precede enabledAt");
        }
    }
}
