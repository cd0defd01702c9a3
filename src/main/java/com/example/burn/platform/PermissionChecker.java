package com.example.burn.platform;

/**
 * Privilege preconditions for enabling burn-after-reading in a group.
 */
public interface PermissionChecker {

    /**
     * Whether the bot can recall other members' messages in the group.
     */
    boolean isBotPrivileged(MessagingPlatformClient client, String guildId);

    /**
     * Whether the bot outranks the user, i.e. the user's role does not dominate the bot's, so
     * the bot is able to recall the user's messages.
     */
    boolean isUserPrivilegedRelativeToBot(MessagingPlatformClient client, String userId, String guildId);
}
