package com.example.burn.access;

import com.example.burn.models.RetentionSession;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for active retention sessions. Keyed by user, so a lookup by user alone answers
 * the "active anywhere?" question. Each group also carries an occupancy count that is updated in
 * the same write as the session itself.
 */
public interface SessionAccess {

    enum CreateOutcome {
        CREATED,
        USER_HAS_SESSION,
        GROUP_FULL
    }

    Optional<RetentionSession> findByUserId(String userId);

    Optional<RetentionSession> findByUserIdAndGuildId(String userId, String guildId);

    /**
     * Number of sessions currently active in a group, read consistently from the occupancy count.
     *
     * @param guildId the group to query
     * @return active sessions, 0 for a group never seen
     */
    int countByGuildId(String guildId);

    /**
     * Loads every stored session. Only the startup recovery pass calls this.
     */
    List<RetentionSession> findAll();

    /**
     * Creates a new session and reserves a slot in its group in one atomic write. Nothing is
     * written unless the user has no session anywhere and the group holds fewer than
     * {@code maxUsers} sessions.
     *
     * @return {@link CreateOutcome#CREATED}, or the first condition that refused the write
     */
    CreateOutcome create(RetentionSession session, int maxUsers);

    /**
     * Removes the user's session if it belongs to the given group and releases its slot. Absence
     * is not an error.
     *
     * @return true when a record was removed
     */
    boolean deleteByUserIdAndGuildId(String userId, String guildId);
}
