package com.example.burn.service;

import com.example.burn.access.CapturedMessageAccess;
import com.example.burn.access.SessionAccess;
import com.example.burn.config.BurnProperties;
import com.example.burn.models.CapturedMessage;
import com.example.burn.platform.MessagingPlatformClient;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Burns a session: removes the session record, then recalls every captured message for the
 * user in that group, one at a time in capture order.
 *
 * <p>The recall delay is slept once before the first deletion and the batch interval between
 * consecutive deletions, never after the last. A failed deletion keeps its ledger entry and does
 * not stop the batch. Failures outside the per-message scope abort the burn; nothing is retried
 * and the session is not re-created.
 *
 * <p>Callers run this on a burn thread: it blocks for at least
 * {@code recallDelay + (n - 1) * batchRecallInterval}.
 */
@Service
@Slf4j
public class BatchRecallService {

    private final SessionAccess sessionAccess;
    private final CapturedMessageAccess capturedMessageAccess;
    private final NoticeTemplates notices;
    private final BurnProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public BatchRecallService(SessionAccess sessionAccess,
                              CapturedMessageAccess capturedMessageAccess,
                              NoticeTemplates notices,
                              BurnProperties properties) {
        this(sessionAccess, capturedMessageAccess, notices, properties, Sleeper.THREAD);
    }

    BatchRecallService(SessionAccess sessionAccess,
                       CapturedMessageAccess capturedMessageAccess,
                       NoticeTemplates notices,
                       BurnProperties properties,
                       Sleeper sleeper) {
        this.sessionAccess = sessionAccess;
        this.capturedMessageAccess = capturedMessageAccess;
        this.notices = notices;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public BurnResult burn(String userId, String guildId, String channelId, MessagingPlatformClient client) {
        String burnId = "burn-" + UUID.randomUUID();
        try {
            boolean sessionRemoved = sessionAccess.deleteByUserIdAndGuildId(userId, guildId);
            log.debug("[{}] Session for user {} in group {} removed={}", burnId, userId, guildId, sessionRemoved);

            List<CapturedMessage> messages = capturedMessageAccess.findAllByUserIdAndGuildId(userId, guildId);
            if (messages.isEmpty()) {
                log.info("[{}] User {} has no messages to recall in group {}", burnId, userId, guildId);
                return BurnResult.nothingToRecall();
            }

            log.info("[{}] Recalling {} messages of user {} in group {} after {}",
                    burnId, messages.size(), userId, guildId, properties.getRecallDelay());
            sleeper.sleep(properties.getRecallDelay());

            int recalled = 0;
            int failed = 0;
            for (int i = 0; i < messages.size(); i++) {
                if (recallOne(burnId, messages.get(i), client)) {
                    recalled++;
                } else {
                    failed++;
                }
                if (i < messages.size() - 1) {
                    sleeper.sleep(properties.getBatchRecallInterval());
                }
            }

            sendCompletion(burnId, client, channelId);
            log.info("[{}] Recall finished for user {} in group {}: recalled={}, failed={}",
                    burnId, userId, guildId, recalled, failed);
            return new BurnResult(messages.size(), recalled, failed, false);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.error("[{}] Burn for user {} in group {} was interrupted", burnId, userId, guildId);
            return BurnResult.abortedBurn();
        } catch (RuntimeException ex) {
            log.error("[{}] Burn for user {} in group {} aborted: {}",
                    burnId, userId, guildId, ex.getMessage(), ex);
            return BurnResult.abortedBurn();
        }
    }

    private boolean recallOne(String burnId, CapturedMessage message, MessagingPlatformClient client) {
        try {
            client.deleteMessage(message.getChannelId(), message.getMessageId());
        } catch (RuntimeException ex) {
            log.warn("[{}] Failed to recall message {} in channel {}: {}",
                    burnId, message.getMessageId(), message.getChannelId(), ex.getMessage());
            return false;
        }
        log.debug("[{}] Recalled message {}", burnId, message.getMessageId());

        try {
            capturedMessageAccess.delete(message);
        } catch (RuntimeException ex) {
            // recalled on the platform; a later burn will retry and fail on it, leaving it in the ledger
            log.warn("[{}] Recalled message {} but could not remove ledger entry {}: {}",
                    burnId, message.getMessageId(), message.getId(), ex.getMessage());
        }
        return true;
    }

    private void sendCompletion(String burnId, MessagingPlatformClient client, String channelId) {
        try {
            client.sendMessage(channelId, notices.completed());
        } catch (RuntimeException ex) {
            log.warn("[{}] Failed to send completion notice to channel {}: {}", burnId, channelId, ex.getMessage());
        }
    }

    /**
     * Outcome of one burn. {@code captured} is the ledger size when the batch started.
     */
    public record BurnResult(int captured, int recalled, int failed, boolean aborted) {

        static BurnResult nothingToRecall() {
            return new BurnResult(0, 0, 0, false);
        }

        static BurnResult abortedBurn() {
            return new BurnResult(0, 0, 0, true);
        }
    }
}
