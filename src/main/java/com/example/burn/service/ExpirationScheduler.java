package com.example.burn.service;

import com.example.burn.access.SessionAccess;
import com.example.burn.config.SchedulingConfig;
import com.example.burn.models.RetentionSession;
import com.example.burn.models.SessionKey;
import com.example.burn.platform.MessagingPlatformClient;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns one expiry timer per active session, keyed by (user, group).
 *
 * <p>Lifecycle of an entry: armed, then either fired or cancelled, and removed in both cases.
 * A firing timer claims its entry before doing anything, so a cancel that wins the claim
 * suppresses the expiry notice and the second burn. The expiry itself runs on the burn executor:
 * the notice is sent, then the burn runs to completion on that thread. A timer whose session is no
 * longer stored, for instance because another instance already burned it, does nothing.
 */
@Component
@Slf4j
public class ExpirationScheduler {

    private final SessionAccess sessionAccess;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor burnExecutor;
    private final BatchRecallService batchRecallService;
    private final MessageCaptureService captureService;
    private final NoticeTemplates notices;

    // guarded by this
    private final Map<SessionKey, ScheduledFuture<?>> armed = new HashMap<>();

    public ExpirationScheduler(SessionAccess sessionAccess,
                               TaskScheduler taskScheduler,
                               @Qualifier(SchedulingConfig.BURN_EXECUTOR) TaskExecutor burnExecutor,
                               BatchRecallService batchRecallService,
                               MessageCaptureService captureService,
                               NoticeTemplates notices) {
        this.sessionAccess = sessionAccess;
        this.taskScheduler = taskScheduler;
        this.burnExecutor = burnExecutor;
        this.batchRecallService = batchRecallService;
        this.captureService = captureService;
        this.notices = notices;
    }

    /**
     * Arms the expiry timer for a session at its expiry instant, replacing any timer already
     * armed for the same user and group.
     */
    public synchronized void arm(RetentionSession session, MessagingPlatformClient client) {
        SessionKey key = session.key();
        ScheduledFuture<?> previous = armed.remove(key);
        if (previous != null) {
            previous.cancel(false);
            log.debug("Replaced expiry timer for {}", key);
        }
        Instant fireAt = Instant.ofEpochMilli(session.getExpiresAt());
        armed.put(key, taskScheduler.schedule(() -> fire(session, client), fireAt));
        log.info("Armed expiry for {} at {}", key, fireAt);
    }

    /**
     * Cancels the timer for a session.
     *
     * @return true when an armed timer was cancelled, false when none was armed or it already fired
     */
    public synchronized boolean cancel(SessionKey key) {
        ScheduledFuture<?> future = armed.remove(key);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.info("Cancelled expiry timer for {}", key);
        return true;
    }

    public synchronized boolean isArmed(SessionKey key) {
        return armed.containsKey(key);
    }

    public synchronized int armedCount() {
        return armed.size();
    }

    private synchronized boolean claim(SessionKey key) {
        return armed.remove(key) != null;
    }

    void fire(RetentionSession session, MessagingPlatformClient client) {
        if (!claim(session.key())) {
            log.debug("Expiry timer for {} was cancelled before it ran", session.key());
            return;
        }
        burnExecutor.execute(() -> expire(session, client));
    }

    void expire(RetentionSession session, MessagingPlatformClient client) {
        try {
            boolean stillStored = sessionAccess.findByUserIdAndGuildId(session.getUserId(), session.getGuildId())
                    .filter(stored -> stored.getExpiresAt().equals(session.getExpiresAt()))
                    .isPresent();
            if (!stillStored) {
                log.info("Session {} is gone, skipping its expiry", session.key());
                return;
            }
            log.info("Burn after reading expired for user {} in group {}", session.getUserId(), session.getGuildId());
            captureService.sendAndCapture(client, session.getUserId(), session.getGuildId(),
                    session.getChannelId(), notices.expired(session.getUserId()));
            batchRecallService.burn(session.getUserId(), session.getGuildId(), session.getChannelId(), client);
        } catch (RuntimeException ex) {
            log.warn("Failed to process expiry for {}: {}", session.key(), ex.getMessage(), ex);
        }
    }
}
