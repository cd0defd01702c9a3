package com.example.burn.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class CapturedMessage {

    // Required fields: Lombok @NonNull null-checks them in the builder
    @NonNull
    private String ownerKey;   // PK, see SessionKey.ownerKey()

    @NonNull
    private Long id;           // SK, ledger sequence in capture order

    @NonNull
    private String messageId;

    @NonNull
    private String userId;

    @NonNull
    private String guildId;

    @NonNull
    private String channelId;

    @NonNull
    private Long sentAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("owner_key")
    public String getOwnerKey() { return ownerKey; }

    @DynamoDbSortKey
    @DynamoDbAttribute("id")
    public Long getId() { return id; }

    @DynamoDbAttribute("message_id")
    public String getMessageId() { return messageId; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("guild_id")
    public String getGuildId() { return guildId; }

    @DynamoDbAttribute("channel_id")
    public String getChannelId() { return channelId; }

    @DynamoDbAttribute("sent_at")
    public Long getSentAt() { return sentAt; }
}
