package com.example.burn.access;

import java.util.Map;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Atomic counter backed by a single item per sequence. {@code ADD} creates the attribute on
 * first use, so no seeding is needed.
 */
@Component
public class DynamoSequenceAccess implements SequenceAccess {

    public static final String TABLE_NAME = "ledger_sequences";

    private final DynamoDbClient dynamo;

    public DynamoSequenceAccess(DynamoDbClient dynamo) {
        this.dynamo = dynamo;
    }

    @Override
    public long next(String sequenceName) {
        UpdateItemResponse response = dynamo.updateItem(r -> r.tableName(TABLE_NAME)
                .key(Map.of("name", AttributeValue.builder().s(sequenceName).build()))
                .updateExpression("ADD next_value :one")
                .expressionAttributeValues(Map.of(":one", AttributeValue.builder().n("1").build()))
                .returnValues(ReturnValue.UPDATED_NEW));
        return Long.parseLong(response.attributes().get("next_value").n());
    }
}
