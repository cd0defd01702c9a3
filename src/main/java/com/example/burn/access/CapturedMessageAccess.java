package com.example.burn.access;

import com.example.burn.models.CapturedMessage;
import java.util.List;

/**
 * Storage port for the captured message ledger.
 */
public interface CapturedMessageAccess {

    CapturedMessage save(CapturedMessage message);

    /**
     * Finds every message captured for a user in a group, ordered by ledger id ascending, which
     * is capture order.
     *
     * @param userId owning user
     * @param guildId group the messages were sent in
     * @return captured messages, oldest first
     */
    List<CapturedMessage> findAllByUserIdAndGuildId(String userId, String guildId);

    /**
     * Removes a single ledger entry. Called only after the platform confirmed the deletion.
     */
    void delete(CapturedMessage message);
}
