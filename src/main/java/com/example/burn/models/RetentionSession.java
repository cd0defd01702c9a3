package com.example.burn.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Duration;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A user's active opt-in to burn-after-reading in one group. Partitioned by user so a user can
 * hold at most one session across all groups.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class RetentionSession {

    @NonNull
    private String userId;

    @NonNull
    private String guildId;

    @NonNull
    private String channelId;

    // platform connection (bot account) that activated the session
    @NonNull
    private String connectionId;

    @NonNull
    private Long enabledAt;

    @NonNull
    private Long expiresAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("guild_id")
    public String getGuildId() { return guildId; }

    @DynamoDbAttribute("channel_id")
    public String getChannelId() { return channelId; }

    @DynamoDbAttribute("connection_id")
    public String getConnectionId() { return connectionId; }

    @DynamoDbAttribute("enabled_at")
    public Long getEnabledAt() { return enabledAt; }

    @DynamoDbAttribute("expires_at")
    public Long getExpiresAt() { return expiresAt; }

    // ----- Domain helpers -----

    public SessionKey key() {
        return new SessionKey(userId, guildId);
    }

    /**
     * Time left until expiry, or {@link Duration#ZERO} once the session is due.
     */
    public Duration remainingAt(Instant now) {
        long remaining = expiresAt - now.toEpochMilli();
        return remaining > 0 ? Duration.ofMillis(remaining) : Duration.ZERO;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt <= now.toEpochMilli();
    }

    public static long calculateExpiresAt(long enabledAtMillis, Duration maxDuration) {
        if (maxDuration.isNegative() || maxDuration.isZero()) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }
        return enabledAtMillis + maxDuration.toMillis();
    }
}
