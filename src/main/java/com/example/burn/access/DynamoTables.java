package com.example.burn.access;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Table definitions for the four tables this service owns. Used for local runs against
 * LocalStack and by the access integration tests.
 */
@Slf4j
public final class DynamoTables {

    private DynamoTables() {
    }

    public static void createIfMissing(DynamoDbClient dynamo) {
        ensureTable(dynamo, sessionsTable());
        ensureTable(dynamo, occupancyTable());
        ensureTable(dynamo, capturedMessagesTable());
        ensureTable(dynamo, sequencesTable());
    }

    private static void ensureTable(DynamoDbClient dynamo, CreateTableRequest request) {
        try {
            dynamo.describeTable(b -> b.tableName(request.tableName()));
        } catch (ResourceNotFoundException ex) {
            log.info("Creating DynamoDB table {}", request.tableName());
            dynamo.createTable(request);
            dynamo.waiter().waitUntilTableExists(b -> b.tableName(request.tableName()));
        }
    }

    static CreateTableRequest sessionsTable() {
        return CreateTableRequest.builder()
                .tableName(DynamoSessionAccess.TABLE_NAME)
                .attributeDefinitions(stringAttribute("user_id"))
                .keySchema(KeySchemaElement.builder().attributeName("user_id").keyType(KeyType.HASH).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
    }

    static CreateTableRequest occupancyTable() {
        return CreateTableRequest.builder()
                .tableName(DynamoSessionAccess.OCCUPANCY_TABLE_NAME)
                .attributeDefinitions(stringAttribute("guild_id"))
                .keySchema(KeySchemaElement.builder().attributeName("guild_id").keyType(KeyType.HASH).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
    }

    static CreateTableRequest capturedMessagesTable() {
        return CreateTableRequest.builder()
                .tableName(DynamoCapturedMessageAccess.TABLE_NAME)
                .attributeDefinitions(
                        stringAttribute("owner_key"),
                        AttributeDefinition.builder().attributeName("id").attributeType(ScalarAttributeType.N).build())
                .keySchema(
                        KeySchemaElement.builder().attributeName("owner_key").keyType(KeyType.HASH).build(),
                        KeySchemaElement.builder().attributeName("id").keyType(KeyType.RANGE).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
    }

    static CreateTableRequest sequencesTable() {
        return CreateTableRequest.builder()
                .tableName(DynamoSequenceAccess.TABLE_NAME)
                .attributeDefinitions(stringAttribute("name"))
                .keySchema(KeySchemaElement.builder().attributeName("name").keyType(KeyType.HASH).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
    }

    private static AttributeDefinition stringAttribute(String name) {
        return AttributeDefinition.builder().attributeName(name).attributeType(ScalarAttributeType.S).build();
    }
}
