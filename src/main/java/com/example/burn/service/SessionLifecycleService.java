package com.example.burn.service;

import com.example.burn.access.SessionAccess;
import com.example.burn.config.BurnProperties;
import com.example.burn.config.SchedulingConfig;
import com.example.burn.models.RetentionSession;
import com.example.burn.platform.GuildInfo;
import com.example.burn.platform.MessagingPlatformClient;
import com.example.burn.platform.PermissionChecker;
import com.example.burn.platform.PlatformClientResolver;
import com.example.burn.requests.ActivateSessionServiceRequest;
import com.example.burn.requests.DeactivateSessionServiceRequest;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Enable/disable entry points. Enforces one session per user across all groups and the
 * per-group capacity, then hands the session to the expiration scheduler or the recall engine.
 */
@Service
@Slf4j
public class SessionLifecycleService {

    private final SessionAccess sessionAccess;
    private final PlatformClientResolver clientResolver;
    private final PermissionChecker permissionChecker;
    private final MessageCaptureService captureService;
    private final ExpirationScheduler expirationScheduler;
    private final BatchRecallService batchRecallService;
    private final TaskExecutor burnExecutor;
    private final NoticeTemplates notices;
    private final BurnProperties properties;
    private final Clock clock;

    // a deactivate for the same user waits until the activation is stored, armed and announced
    private final ConcurrentMap<String, Object> userLocks = new ConcurrentHashMap<>();

    public SessionLifecycleService(SessionAccess sessionAccess,
                                   PlatformClientResolver clientResolver,
                                   PermissionChecker permissionChecker,
                                   MessageCaptureService captureService,
                                   ExpirationScheduler expirationScheduler,
                                   BatchRecallService batchRecallService,
                                   @Qualifier(SchedulingConfig.BURN_EXECUTOR) TaskExecutor burnExecutor,
                                   NoticeTemplates notices,
                                   BurnProperties properties,
                                   Clock clock) {
        this.sessionAccess = sessionAccess;
        this.clientResolver = clientResolver;
        this.permissionChecker = permissionChecker;
        this.captureService = captureService;
        this.expirationScheduler = expirationScheduler;
        this.batchRecallService = batchRecallService;
        this.burnExecutor = burnExecutor;
        this.notices = notices;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Turns burn-after-reading on for a user in a group.
     *
     * <p>Preconditions are checked in order and the first failure is thrown as a
     * {@link BurnException}: group context, bot privilege, user rank below the bot, no session
     * for the user in any group, group below capacity.
     */
    public ActivationResult activate(ActivateSessionServiceRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.guildId() == null) {
            throw BurnException.notInGroup();
        }
        String userId = request.userId();
        String guildId = request.guildId();
        MessagingPlatformClient client = resolveClient(request.connectionId());

        if (!permissionChecker.isBotPrivileged(client, guildId)) {
            throw BurnException.botNotPrivileged();
        }
        if (!permissionChecker.isUserPrivilegedRelativeToBot(client, userId, guildId)) {
            throw BurnException.userOutranksBot();
        }

        RetentionSession session;
        synchronized (userLock(userId)) {
            session = createSession(request, client);
            if (request.messageId() != null) {
                captureService.capture(userId, guildId, request.channelId(), request.messageId());
            }
            expirationScheduler.arm(session, client);
            captureService.sendAndCapture(client, userId, guildId, request.channelId(), notices.activated());
        }

        log.info("Burn after reading enabled for user {} in group {} until {}",
                userId, guildId, session.getExpiresAt());
        return new ActivationResult(session);
    }

    private RetentionSession createSession(ActivateSessionServiceRequest request, MessagingPlatformClient client) {
        Optional<RetentionSession> existing = sessionAccess.findByUserId(request.userId());
        if (existing.isPresent()) {
            throw rejectExisting(existing.get(), request.guildId(), client);
        }
        if (sessionAccess.countByGuildId(request.guildId()) >= properties.getMaxUsers()) {
            throw BurnException.groupFull(properties.getMaxUsers());
        }

        long now = clock.millis();
        RetentionSession session = RetentionSession.builder()
                .userId(request.userId())
                .guildId(request.guildId())
                .channelId(request.channelId())
                .connectionId(client.connectionId())
                .enabledAt(now)
                .expiresAt(RetentionSession.calculateExpiresAt(now, properties.getMaxDuration()))
                .build();

        // the store re-checks both conditions atomically, other instances may have written since
        switch (sessionAccess.create(session, properties.getMaxUsers())) {
            case CREATED:
                return session;
            case GROUP_FULL:
                log.info("Group {} reached capacity before user {} could join", request.guildId(), request.userId());
                throw BurnException.groupFull(properties.getMaxUsers());
            case USER_HAS_SESSION:
            default:
                throw sessionAccess.findByUserId(request.userId())
                        .map(winner -> rejectExisting(winner, request.guildId(), client))
                        .orElseGet(BurnException::alreadyActive);
        }
    }

    /**
     * Turns burn-after-reading off in the current group. Cancels the expiry timer, sends the
     * closing notice and starts the burn without waiting for it.
     */
    public DeactivationResult deactivate(DeactivateSessionServiceRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.guildId() == null) {
            throw BurnException.notInGroup();
        }
        String userId = request.userId();
        String guildId = request.guildId();
        MessagingPlatformClient client = resolveClient(request.connectionId());

        RetentionSession session;
        boolean timerCancelled;
        synchronized (userLock(userId)) {
            Optional<RetentionSession> current = sessionAccess.findByUserIdAndGuildId(userId, guildId);
            if (current.isEmpty()) {
                Optional<RetentionSession> elsewhere = sessionAccess.findByUserId(userId);
                if (elsewhere.isPresent()) {
                    throw BurnException.notActiveHere(guildDisplayName(client, elsewhere.get().getGuildId()));
                }
                throw BurnException.notActive();
            }
            session = current.get();
            timerCancelled = expirationScheduler.cancel(session.key());
        }
        captureService.sendAndCapture(client, userId, guildId, request.channelId(), notices.deactivated());
        burnExecutor.execute(() -> batchRecallService.burn(userId, guildId, request.channelId(), client));

        log.info("Burn after reading disabled for user {} in group {} (timer cancelled={})",
                userId, guildId, timerCancelled);
        return new DeactivationResult(session, timerCancelled);
    }

    public Optional<RetentionSession> findActiveSession(String userId) {
        Objects.requireNonNull(userId, "userId");
        return sessionAccess.findByUserId(userId);
    }

    private Object userLock(String userId) {
        return userLocks.computeIfAbsent(userId, k -> new Object());
    }

    private MessagingPlatformClient resolveClient(String connectionId) {
        return clientResolver.resolve(connectionId)
                .orElseThrow(() -> BurnException.unknownConnection(connectionId));
    }

    private BurnException rejectExisting(RetentionSession existing, String guildId, MessagingPlatformClient client) {
        if (existing.getGuildId().equals(guildId)) {
            return BurnException.alreadyActive();
        }
        return BurnException.activeInOtherGroup(guildDisplayName(client, existing.getGuildId()));
    }

    private String guildDisplayName(MessagingPlatformClient client, String guildId) {
        try {
            return client.getGuild(guildId).map(GuildInfo::displayName).orElse(guildId);
        } catch (RuntimeException ex) {
            log.debug("Failed to look up group {}: {}", guildId, ex.getMessage());
            return guildId;
        }
    }

    public record ActivationResult(RetentionSession session) { }

    public record DeactivationResult(RetentionSession session, boolean timerCancelled) { }
}
