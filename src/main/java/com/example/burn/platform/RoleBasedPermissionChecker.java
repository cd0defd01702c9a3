package com.example.burn.platform;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives both checks from member roles. Lookup failures count as "not privileged".
 */
@Component
@Slf4j
public class RoleBasedPermissionChecker implements PermissionChecker {

    @Override
    public boolean isBotPrivileged(MessagingPlatformClient client, String guildId) {
        if (guildId == null) {
            return false;
        }
        try {
            return client.getMemberRole(guildId, client.selfId()) != GroupRole.MEMBER;
        } catch (PlatformException ex) {
            log.warn("Failed to check bot role in group {}: {}", guildId, ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean isUserPrivilegedRelativeToBot(MessagingPlatformClient client, String userId, String guildId) {
        if (guildId == null) {
            return false;
        }
        try {
            GroupRole userRole = client.getMemberRole(guildId, userId);
            GroupRole botRole = client.getMemberRole(guildId, client.selfId());
            if (userRole == GroupRole.OWNER) {
                return false;
            }
            return userRole != GroupRole.ADMIN || botRole == GroupRole.OWNER;
        } catch (PlatformException ex) {
            log.warn("Failed to check role of user {} in group {}: {}", userId, guildId, ex.getMessage());
            return false;
        }
    }
}
