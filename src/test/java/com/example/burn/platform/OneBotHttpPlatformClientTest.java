package com.example.burn.platform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.burn.config.BurnProperties;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OneBotHttpPlatformClientTest {

    private static final String BASE_URL = "http://onebot.local";

    private MockRestServiceServer server;
    private OneBotHttpPlatformClient client;

    @BeforeEach
    void setUp() {
        BurnProperties.Connection connection = new BurnProperties.Connection();
        connection.setId("10001");
        connection.setBaseUrl(BASE_URL);
        connection.setAccessToken("secret");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OneBotHttpPlatformClient("10001", "10001", OneBotHttpPlatformClient.configure(connection, builder).build());
    }

    @Test
    @DisplayName("sendMessage posts send_group_msg with the access token and returns the message id")
    void sendMessage() {
        server.expect(requestTo(BASE_URL + "/send_group_msg"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret"))
                .andExpect(content().json("{\"group_id\":123456,\"message\":\"hello\"}"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"retcode\":0,\"data\":{\"message_id\":555}}",
                        MediaType.APPLICATION_JSON));

        assertEquals("555", client.sendMessage("123456", "hello"));
        server.verify();
    }

    @Test
    @DisplayName("deleteMessage posts delete_msg with the numeric message id")
    void deleteMessage() {
        server.expect(requestTo(BASE_URL + "/delete_msg"))
                .andExpect(content().json("{\"message_id\":555}"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"retcode\":0,\"data\":null}", MediaType.APPLICATION_JSON));

        client.deleteMessage("123456", "555");
        server.verify();
    }

    @Test
    @DisplayName("a non-zero retcode is a platform failure")
    void nonZeroRetcode() {
        server.expect(requestTo(BASE_URL + "/delete_msg"))
                .andRespond(withSuccess("{\"status\":\"failed\",\"retcode\":100,\"message\":\"too old\"}",
                        MediaType.APPLICATION_JSON));

        PlatformException ex = assertThrows(PlatformException.class, () -> client.deleteMessage("123456", "555"));
        assertTrue(ex.getMessage().contains("100"), ex.getMessage());
    }

    @Test
    @DisplayName("an HTTP error is a platform failure")
    void httpError() {
        server.expect(requestTo(BASE_URL + "/send_group_msg")).andRespond(withServerError());

        assertThrows(PlatformException.class, () -> client.sendMessage("123456", "hello"));
    }

    @Test
    @DisplayName("non-numeric ids are rejected without a request")
    void nonNumericId() {
        assertThrows(PlatformException.class, () -> client.deleteMessage("123456", "abc"));
        server.verify();
    }

    @Test
    @DisplayName("getGuild returns the group name")
    void getGuild() {
        server.expect(requestTo(BASE_URL + "/get_group_info"))
                .andExpect(content().json("{\"group_id\":123456}"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"retcode\":0,\"data\":{\"group_id\":123456,"
                        + "\"group_name\":\"Book Club\",\"member_count\":20}}", MediaType.APPLICATION_JSON));

        assertEquals(Optional.of(new GuildInfo("123456", "Book Club")), client.getGuild("123456"));
    }

    @Test
    @DisplayName("getGuild failures read as unknown group")
    void getGuildFailure() {
        server.expect(requestTo(BASE_URL + "/get_group_info")).andRespond(withServerError());

        assertEquals(Optional.empty(), client.getGuild("123456"));
    }

    @Test
    @DisplayName("getMemberRole maps the OneBot role")
    void getMemberRole() {
        server.expect(requestTo(BASE_URL + "/get_group_member_info"))
                .andExpect(content().json("{\"group_id\":123456,\"user_id\":10001}"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"retcode\":0,\"data\":{\"role\":\"admin\"}}",
                        MediaType.APPLICATION_JSON));

        assertEquals(GroupRole.ADMIN, client.getMemberRole("123456", "10001"));
    }

    @Test
    @DisplayName("an unknown role is a platform failure")
    void unknownRole() {
        server.expect(requestTo(BASE_URL + "/get_group_member_info"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"retcode\":0,\"data\":{\"role\":\"moderator\"}}",
                        MediaType.APPLICATION_JSON));

        assertThrows(PlatformException.class, () -> client.getMemberRole("123456", "10001"));
    }

    @Test
    @DisplayName("a connection without base-url is rejected")
    void missingBaseUrl() {
        BurnProperties.Connection connection = new BurnProperties.Connection();
        connection.setId("10001");

        assertThrows(IllegalArgumentException.class,
                () -> new OneBotHttpPlatformClient(connection, RestClient.builder()));
    }

    @Test
    @DisplayName("a non-numeric connection id needs an explicit self-id")
    void nonNumericIdNeedsSelfId() {
        BurnProperties.Connection connection = new BurnProperties.Connection();
        connection.setId("main");
        connection.setBaseUrl(BASE_URL);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new OneBotHttpPlatformClient(connection, RestClient.builder()));
        assertTrue(ex.getMessage().contains("self-id"), ex.getMessage());

        connection.setSelfId("10001");
        OneBotHttpPlatformClient named = new OneBotHttpPlatformClient(connection, RestClient.builder());
        assertEquals("main", named.connectionId());
        assertEquals("10001", named.selfId());
    }

    @Test
    @DisplayName("self-id defaults to the connection id")
    void selfIdDefaultsToId() {
        assertEquals("10001", client.selfId());
    }
}
