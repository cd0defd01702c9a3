package com.example.burn.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.burn.access.SessionAccess.CreateOutcome;
import com.example.burn.models.RetentionSession;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoSessionAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbClient dynamo;
    private DynamoDbEnhancedClient enhancedClient;
    private SessionAccess sessionAccess;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
        DynamoTables.createIfMissing(dynamo);

        sessionAccess = new DynamoSessionAccess(enhancedClient, dynamo);
    }

    @BeforeEach
    void cleanup() {
        var table = enhancedClient.table(DynamoSessionAccess.TABLE_NAME, TableSchema.fromBean(RetentionSession.class));
        table.scan().items().forEach(table::deleteItem);
        dynamo.scan(r -> r.tableName(DynamoSessionAccess.OCCUPANCY_TABLE_NAME)).items()
                .forEach(item -> dynamo.deleteItem(r -> r.tableName(DynamoSessionAccess.OCCUPANCY_TABLE_NAME)
                        .key(Map.of("guild_id", item.get("guild_id")))));
    }

    @Test
    @DisplayName("create then findByUserId round-trips every attribute")
    void createAndFind() {
        assertEquals(CreateOutcome.CREATED, sessionAccess.create(session("alice", "g1"), 10));

        RetentionSession found = sessionAccess.findByUserId("alice").orElseThrow();
        assertEquals("g1", found.getGuildId());
        assertEquals("c-g1", found.getChannelId());
        assertEquals("bot", found.getConnectionId());
        assertEquals(CLOCK.millis(), found.getEnabledAt());
        assertEquals(CLOCK.millis() + 3_600_000L, found.getExpiresAt());
        assertTrue(sessionAccess.findByUserIdAndGuildId("alice", "g1").isPresent());
        assertTrue(sessionAccess.findByUserIdAndGuildId("alice", "g2").isEmpty());
    }

    @Test
    @DisplayName("a second session for the same user is refused whatever the group")
    void oneSessionPerUser() {
        sessionAccess.create(session("alice", "g1"), 10);

        assertEquals(CreateOutcome.USER_HAS_SESSION, sessionAccess.create(session("alice", "g2"), 10));
        assertEquals("g1", sessionAccess.findByUserId("alice").orElseThrow().getGuildId());
        assertEquals(0, sessionAccess.countByGuildId("g2"));
    }

    @Test
    @DisplayName("the occupancy count refuses a session beyond the group capacity")
    void capacityEnforcedByCounter() {
        assertEquals(CreateOutcome.CREATED, sessionAccess.create(session("alice", "g1"), 2));
        assertEquals(CreateOutcome.CREATED, sessionAccess.create(session("bob", "g1"), 2));
        assertEquals(CreateOutcome.CREATED, sessionAccess.create(session("carol", "g2"), 2));

        assertEquals(CreateOutcome.GROUP_FULL, sessionAccess.create(session("dave", "g1"), 2));
        assertTrue(sessionAccess.findByUserId("dave").isEmpty());
        assertEquals(2, sessionAccess.countByGuildId("g1"));
        assertEquals(1, sessionAccess.countByGuildId("g2"));
        assertEquals(0, sessionAccess.countByGuildId("g3"));
        assertEquals(3, sessionAccess.findAll().size());
    }

    @Test
    @DisplayName("deleting a session frees its slot for the next activation")
    void deleteReleasesSlot() {
        sessionAccess.create(session("alice", "g1"), 1);
        assertEquals(CreateOutcome.GROUP_FULL, sessionAccess.create(session("bob", "g1"), 1));

        assertTrue(sessionAccess.deleteByUserIdAndGuildId("alice", "g1"));

        assertEquals(0, sessionAccess.countByGuildId("g1"));
        assertEquals(CreateOutcome.CREATED, sessionAccess.create(session("bob", "g1"), 1));
    }

    @Test
    @DisplayName("delete only removes the session of the named group")
    void deleteGuarded() {
        sessionAccess.create(session("alice", "g1"), 10);

        assertFalse(sessionAccess.deleteByUserIdAndGuildId("alice", "g2"));
        assertTrue(sessionAccess.findByUserId("alice").isPresent());
        assertEquals(1, sessionAccess.countByGuildId("g1"));
        assertEquals(0, sessionAccess.countByGuildId("g2"));

        assertTrue(sessionAccess.deleteByUserIdAndGuildId("alice", "g1"));
        assertTrue(sessionAccess.findByUserId("alice").isEmpty());
        assertFalse(sessionAccess.deleteByUserIdAndGuildId("alice", "g1"));
        assertEquals(0, sessionAccess.countByGuildId("g1"));
    }

    private static RetentionSession session(String userId, String guildId) {
        return RetentionSession.builder()
                .userId(userId)
                .guildId(guildId)
                .channelId("c-" + guildId)
                .connectionId("bot")
                .enabledAt(CLOCK.millis())
                .expiresAt(CLOCK.millis() + 3_600_000L)
                .build();
    }
}
