package com.example.burn.platform;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulated connection that only logs. The bot reports itself as group owner so local commands
 * pass the privilege checks for ordinary members.
 */
@Slf4j
public class LocalMessagingPlatformClient implements MessagingPlatformClient {

    private final String connectionId;
    private final AtomicLong messageIds = new AtomicLong();

    public LocalMessagingPlatformClient(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public String selfId() {
        return connectionId;
    }

    @Override
    public String sendMessage(String channelId, String text) {
        String messageId = connectionId + "-" + messageIds.incrementAndGet();
        log.info("[{}] simulated send channel={} messageId={} text={}", connectionId, channelId, messageId, text);
        return messageId;
    }

    @Override
    public void deleteMessage(String channelId, String messageId) {
        log.info("[{}] simulated recall channel={} messageId={}", connectionId, channelId, messageId);
    }

    @Override
    public Optional<GuildInfo> getGuild(String guildId) {
        return Optional.empty();
    }

    @Override
    public GroupRole getMemberRole(String guildId, String userId) {
        return selfId().equals(userId) ? GroupRole.OWNER : GroupRole.MEMBER;
    }
}
