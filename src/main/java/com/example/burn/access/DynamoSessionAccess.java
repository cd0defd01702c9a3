package com.example.burn.access;

import com.example.burn.models.RetentionSession;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;

/**
 * Sessions live in {@value #TABLE_NAME}, one item per user. Group capacity is enforced through a
 * counter item per group in {@value #OCCUPANCY_TABLE_NAME}; session writes and counter updates
 * always go through the same {@code TransactWriteItems} call, so the two cannot drift apart.
 */
@Component
public class DynamoSessionAccess implements SessionAccess {

    public static final String TABLE_NAME = "retention_sessions";
    public static final String OCCUPANCY_TABLE_NAME = "guild_occupancy";

    private static final String CONDITION_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamo;
    private final DynamoDbTable<RetentionSession> table;

    public DynamoSessionAccess(DynamoDbEnhancedClient enhancedClient, DynamoDbClient dynamo) {
        this.dynamo = dynamo;
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(RetentionSession.class));
    }

    @Override
    public Optional<RetentionSession> findByUserId(String userId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(userId))
                .consistentRead(true)));
    }

    @Override
    public Optional<RetentionSession> findByUserIdAndGuildId(String userId, String guildId) {
        return findByUserId(userId)
                .filter(session -> session.getGuildId().equals(guildId));
    }

    @Override
    public int countByGuildId(String guildId) {
        GetItemResponse response = dynamo.getItem(r -> r.tableName(OCCUPANCY_TABLE_NAME)
                .key(guildKey(guildId))
                .consistentRead(true));
        AttributeValue active = response.hasItem() ? response.item().get("active") : null;
        return active == null ? 0 : Integer.parseInt(active.n());
    }

    @Override
    public List<RetentionSession> findAll() {
        return table.scan()
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public CreateOutcome create(RetentionSession session, int maxUsers) {
        TransactWriteItem put = TransactWriteItem.builder()
                .put(Put.builder()
                        .tableName(TABLE_NAME)
                        .item(table.tableSchema().itemToMap(session, true))
                        .conditionExpression("attribute_not_exists(user_id)")
                        .build())
                .build();
        TransactWriteItem reserve = TransactWriteItem.builder()
                .update(Update.builder()
                        .tableName(OCCUPANCY_TABLE_NAME)
                        .key(guildKey(session.getGuildId()))
                        .updateExpression("ADD active :one")
                        .conditionExpression("attribute_not_exists(active) OR active < :max")
                        .expressionAttributeValues(Map.of(
                                ":one", number(1),
                                ":max", number(maxUsers)))
                        .build())
                .build();
        try {
            dynamo.transactWriteItems(r -> r.transactItems(put, reserve));
            return CreateOutcome.CREATED;
        } catch (TransactionCanceledException ex) {
            if (conditionFailed(ex, 0)) {
                return CreateOutcome.USER_HAS_SESSION;
            }
            if (conditionFailed(ex, 1)) {
                return CreateOutcome.GROUP_FULL;
            }
            throw ex;
        }
    }

    @Override
    public boolean deleteByUserIdAndGuildId(String userId, String guildId) {
        // only removes the session while it still belongs to this group
        TransactWriteItem remove = TransactWriteItem.builder()
                .delete(Delete.builder()
                        .tableName(TABLE_NAME)
                        .key(Map.of("user_id", AttributeValue.builder().s(userId).build()))
                        .conditionExpression("guild_id = :guild")
                        .expressionAttributeValues(Map.of(":guild", AttributeValue.builder().s(guildId).build()))
                        .build())
                .build();
        TransactWriteItem release = TransactWriteItem.builder()
                .update(Update.builder()
                        .tableName(OCCUPANCY_TABLE_NAME)
                        .key(guildKey(guildId))
                        .updateExpression("ADD active :minus_one")
                        .expressionAttributeValues(Map.of(":minus_one", number(-1)))
                        .build())
                .build();
        try {
            dynamo.transactWriteItems(r -> r.transactItems(remove, release));
            return true;
        } catch (TransactionCanceledException ex) {
            if (conditionFailed(ex, 0)) {
                return false;
            }
            throw ex;
        }
    }

    private static boolean conditionFailed(TransactionCanceledException ex, int index) {
        if (!ex.hasCancellationReasons() || ex.cancellationReasons().size() <= index) {
            return false;
        }
        CancellationReason reason = ex.cancellationReasons().get(index);
        return CONDITION_FAILED.equals(reason.code());
    }

    private static Map<String, AttributeValue> guildKey(String guildId) {
        return Map.of("guild_id", AttributeValue.builder().s(guildId).build());
    }

    private static AttributeValue number(int value) {
        return AttributeValue.builder().n(Integer.toString(value)).build();
    }

    private Key buildKey(String userId) {
        return Key.builder().partitionValue(userId).build();
    }
}
