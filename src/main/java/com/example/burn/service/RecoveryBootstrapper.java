package com.example.burn.service;

import com.example.burn.access.SessionAccess;
import com.example.burn.config.SchedulingConfig;
import com.example.burn.models.RetentionSession;
import com.example.burn.platform.MessagingPlatformClient;
import com.example.burn.platform.PlatformClientResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the expiry timers from stored sessions once the application is ready. Sessions that
 * expired while the process was down are burned straight away.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "burn.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class RecoveryBootstrapper {

    private final SessionAccess sessionAccess;
    private final PlatformClientResolver clientResolver;
    private final ExpirationScheduler expirationScheduler;
    private final BatchRecallService batchRecallService;
    private final TaskExecutor burnExecutor;
    private final Clock clock;

    public RecoveryBootstrapper(SessionAccess sessionAccess,
                                PlatformClientResolver clientResolver,
                                ExpirationScheduler expirationScheduler,
                                BatchRecallService batchRecallService,
                                @Qualifier(SchedulingConfig.BURN_EXECUTOR) TaskExecutor burnExecutor,
                                Clock clock) {
        this.sessionAccess = sessionAccess;
        this.clientResolver = clientResolver;
        this.expirationScheduler = expirationScheduler;
        this.batchRecallService = batchRecallService;
        this.burnExecutor = burnExecutor;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        List<RetentionSession> sessions;
        try {
            sessions = sessionAccess.findAll();
        } catch (RuntimeException ex) {
            log.error("Session recovery failed, could not load sessions: {}", ex.getMessage(), ex);
            return new RecoveryResult(0, 0, 0, 0);
        }

        Instant now = clock.instant();
        int rearmed = 0;
        int burned = 0;
        int skipped = 0;

        for (RetentionSession session : sessions) {
            try {
                Optional<MessagingPlatformClient> client = clientResolver.resolve(session.getConnectionId());
                if (client.isEmpty()) {
                    skipped++;
                    log.warn("No platform connection {} for session {}, leaving it for the next start",
                            session.getConnectionId(), session.key());
                    continue;
                }
                if (session.isExpiredAt(now)) {
                    log.info("Session {} expired while offline, burning now", session.key());
                    MessagingPlatformClient resolved = client.get();
                    burnExecutor.execute(() -> batchRecallService.burn(
                            session.getUserId(), session.getGuildId(), session.getChannelId(), resolved));
                    burned++;
                } else {
                    expirationScheduler.arm(session, client.get());
                    log.info("Re-armed session {}, {} remaining", session.key(), session.remainingAt(now));
                    rearmed++;
                }
            } catch (RuntimeException ex) {
                skipped++;
                log.error("Failed to recover session {}: {}", session.key(), ex.getMessage(), ex);
            }
        }

        log.info("Session recovery complete: total={}, rearmed={}, burned={}, skipped={}",
                sessions.size(), rearmed, burned, skipped);
        return new RecoveryResult(sessions.size(), rearmed, burned, skipped);
    }

    public record RecoveryResult(int total, int rearmed, int burned, int skipped) { }
}
