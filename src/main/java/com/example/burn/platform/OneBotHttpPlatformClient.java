package com.example.burn.platform;

import com.example.burn.config.BurnProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client for a OneBot v11 implementation exposing the HTTP API. Channel and group ids coincide
 * for group chats, so messages are sent with {@code send_group_msg}.
 */
@Slf4j
public class OneBotHttpPlatformClient implements MessagingPlatformClient {

    private static final ParameterizedTypeReference<OneBotResponse<SendMessageData>> SEND_RESPONSE =
            new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<OneBotResponse<GroupInfoData>> GROUP_RESPONSE =
            new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<OneBotResponse<MemberInfoData>> MEMBER_RESPONSE =
            new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<OneBotResponse<Object>> EMPTY_RESPONSE =
            new ParameterizedTypeReference<>() { };

    private final String connectionId;
    private final String selfId;
    private final RestClient restClient;

    public OneBotHttpPlatformClient(BurnProperties.Connection connection, RestClient.Builder builder) {
        this(connection.getId(), connection.effectiveSelfId(), configure(connection, builder)
                .requestFactory(timeoutRequestFactory(connection))
                .build());
    }

    OneBotHttpPlatformClient(String connectionId, String selfId, RestClient restClient) {
        this.connectionId = connectionId;
        this.selfId = selfId;
        this.restClient = restClient;
    }

    static RestClient.Builder configure(BurnProperties.Connection connection, RestClient.Builder builder) {
        if (connection.getBaseUrl() == null || connection.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("OneBot connection " + connection.getId() + " needs a base-url");
        }
        if (!isNumeric(connection.effectiveSelfId())) {
            throw new IllegalArgumentException("OneBot connection " + connection.getId()
                    + " needs a numeric self-id, got " + connection.effectiveSelfId());
        }
        builder.baseUrl(connection.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (connection.getAccessToken() != null && !connection.getAccessToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + connection.getAccessToken());
        }
        return builder;
    }

    private static SimpleClientHttpRequestFactory timeoutRequestFactory(BurnProperties.Connection connection) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connection.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) connection.getTimeout().toMillis());
        return requestFactory;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public String selfId() {
        return selfId;
    }

    @Override
    public String sendMessage(String channelId, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("group_id", numericId(channelId));
        body.put("message", text);
        SendMessageData data = call("/send_group_msg", body, SEND_RESPONSE);
        if (data == null || data.messageId() == null) {
            throw new PlatformException("send_group_msg returned no message_id");
        }
        return String.valueOf(data.messageId());
    }

    @Override
    public void deleteMessage(String channelId, String messageId) {
        call("/delete_msg", Map.of("message_id", numericId(messageId)), EMPTY_RESPONSE);
    }

    @Override
    public Optional<GuildInfo> getGuild(String guildId) {
        try {
            GroupInfoData data = call("/get_group_info", Map.of("group_id", numericId(guildId)), GROUP_RESPONSE);
            return Optional.ofNullable(data).map(d -> new GuildInfo(guildId, d.groupName()));
        } catch (PlatformException ex) {
            log.debug("[{}] get_group_info failed for {}: {}", connectionId, guildId, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public GroupRole getMemberRole(String guildId, String userId) {
        Map<String, Object> body = Map.of(
                "group_id", numericId(guildId),
                "user_id", numericId(userId));
        MemberInfoData data = call("/get_group_member_info", body, MEMBER_RESPONSE);
        if (data == null || data.role() == null) {
            throw new PlatformException("get_group_member_info returned no role");
        }
        try {
            return GroupRole.fromString(data.role());
        } catch (IllegalArgumentException ex) {
            throw new PlatformException("get_group_member_info returned unknown role " + data.role(), ex);
        }
    }

    private <T> T call(String action, Map<String, Object> body, ParameterizedTypeReference<OneBotResponse<T>> type) {
        OneBotResponse<T> response;
        try {
            response = restClient.post()
                    .uri(action)
                    .body(body)
                    .retrieve()
                    .body(type);
        } catch (RestClientException ex) {
            throw new PlatformException("OneBot " + action + " failed: " + ex.getMessage(), ex);
        }
        if (response == null) {
            throw new PlatformException("OneBot " + action + " returned an empty body");
        }
        if (!response.isOk()) {
            throw new PlatformException("OneBot " + action + " failed with retcode " + response.retcode()
                    + (response.message() != null ? ": " + response.message() : ""));
        }
        return response.data();
    }

    private static boolean isNumeric(String id) {
        return id != null && !id.isEmpty() && id.chars().allMatch(Character::isDigit);
    }

    private static long numericId(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException ex) {
            throw new PlatformException("OneBot ids must be numeric, got " + id, ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OneBotResponse<T>(
            @JsonProperty("status") String status,
            @JsonProperty("retcode") Integer retcode,
            @JsonProperty("message") String message,
            @JsonProperty("data") T data
    ) {
        boolean isOk() {
            return retcode != null && retcode == 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SendMessageData(@JsonProperty("message_id") Long messageId) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroupInfoData(@JsonProperty("group_name") String groupName) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MemberInfoData(@JsonProperty("role") String role) { }
}
