package com.example.burn.access;

import com.example.burn.models.CapturedMessage;
import com.example.burn.models.SessionKey;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoCapturedMessageAccess implements CapturedMessageAccess {

    public static final String TABLE_NAME = "captured_messages";

    private final DynamoDbTable<CapturedMessage> table;

    public DynamoCapturedMessageAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(CapturedMessage.class));
    }

    @Override
    public CapturedMessage save(CapturedMessage message) {
        table.putItem(message);
        return message;
    }

    @Override
    public List<CapturedMessage> findAllByUserIdAndGuildId(String userId, String guildId) {
        String ownerKey = new SessionKey(userId, guildId).ownerKey();
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(ownerKey).build()))
                        .consistentRead(true)
                        .scanIndexForward(true))
                .items()
                .stream()
                .filter(m -> userId.equals(m.getUserId()) && guildId.equals(m.getGuildId()))
                .collect(Collectors.toList());
    }

    @Override
    public void delete(CapturedMessage message) {
        table.deleteItem(Key.builder()
                .partitionValue(message.getOwnerKey())
                .sortValue(message.getId())
                .build());
    }
}
