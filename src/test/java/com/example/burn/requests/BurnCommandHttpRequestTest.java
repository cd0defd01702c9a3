package com.example.burn.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BurnCommandHttpRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("reads snake_case fields and maps to both service requests")
    void readsSnakeCase() throws Exception {
        BurnCommandHttpRequest request = MAPPER.readValue(
                "{\"connection_id\":\"bot\",\"user_id\":\"alice\",\"guild_id\":\"g1\","
                        + "\"channel_id\":\"c1\",\"message_id\":\"m1\"}",
                BurnCommandHttpRequest.class);

        ActivateSessionServiceRequest activate = request.toActivateRequest();
        assertEquals("alice", activate.userId());
        assertEquals("m1", activate.messageId());

        DeactivateSessionServiceRequest deactivate = request.toDeactivateRequest();
        assertEquals("g1", deactivate.guildId());
        assertEquals("c1", deactivate.channelId());
    }

    @Test
    @DisplayName("omits null fields when serialized")
    void omitsNulls() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(
                new BurnCommandHttpRequest("bot", "alice", null, "dm", null)));

        assertFalse(json.has("guild_id"));
        assertFalse(json.has("message_id"));
        assertEquals("alice", json.get("user_id").asText());
    }

    @Test
    @DisplayName("message events map to inbound messages")
    void messageEvent() throws Exception {
        MessageEventHttpRequest event = MAPPER.readValue(
                "{\"user_id\":\"alice\",\"channel_id\":\"dm\",\"message_id\":\"m1\"}",
                MessageEventHttpRequest.class);

        InboundMessage message = event.toInboundMessage();
        assertNull(message.guildId());
        assertNull(message.connectionId());
        assertEquals("m1", message.messageId());
    }
}
