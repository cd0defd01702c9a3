package com.example.burn.platform;

import java.util.Optional;

/**
 * One connection (bot account) to the messaging platform. Instances are shared between
 * concurrent burns and must be safe for concurrent use.
 */
public interface MessagingPlatformClient {

    /**
     * Identifier of this connection as configured. Sessions record it so recovery can find the
     * connection again.
     */
    String connectionId();

    /**
     * The bot account's own user id on the platform, used for its role lookups.
     */
    String selfId();

    /**
     * Sends a text message and returns the platform id of the sent message.
     *
     * @throws PlatformException when the platform rejects or cannot be reached
     */
    String sendMessage(String channelId, String text);

    /**
     * Recalls a message. Returning normally means the platform confirmed the deletion.
     *
     * @throws PlatformException when the deletion could not be confirmed
     */
    void deleteMessage(String channelId, String messageId);

    /**
     * Best-effort group lookup, empty when the platform does not know the group or the call fails.
     */
    Optional<GuildInfo> getGuild(String guildId);

    /**
     * @throws PlatformException when the member lookup fails
     */
    GroupRole getMemberRole(String guildId, String userId);
}
