package com.example.burn.service;

import com.example.burn.access.CapturedMessageAccess;
import com.example.burn.access.SequenceAccess;
import com.example.burn.access.SessionAccess;
import com.example.burn.models.CapturedMessage;
import com.example.burn.models.SessionKey;
import com.example.burn.platform.MessagingPlatformClient;
import com.example.burn.requests.InboundMessage;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Appends messages to the ledger while their sender has an active session. Every write here is
 * best-effort: failures are logged and never reach the sender.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageCaptureService {

    static final String LEDGER_SEQUENCE = "captured_messages";

    private final SessionAccess sessionAccess;
    private final CapturedMessageAccess capturedMessageAccess;
    private final SequenceAccess sequenceAccess;
    private final Clock clock;

    /**
     * Captures an inbound message if its sender currently has a session in that group.
     *
     * @return true when the message was appended to the ledger
     */
    public boolean onInboundMessage(InboundMessage message) {
        if (!message.isRecallable()) {
            return false;
        }
        try {
            if (sessionAccess.findByUserIdAndGuildId(message.userId(), message.guildId()).isEmpty()) {
                return false;
            }
            append(message.userId(), message.guildId(), message.channelId(), message.messageId());
            return true;
        } catch (RuntimeException ex) {
            log.warn("Failed to capture message {} from user {} in group {}: {}",
                    message.messageId(), message.userId(), message.guildId(), ex.getMessage());
            return false;
        }
    }

    /**
     * Captures a message known to belong to a session, such as the command that enabled it.
     */
    public Optional<CapturedMessage> capture(String userId, String guildId, String channelId, String messageId) {
        try {
            return Optional.of(append(userId, guildId, channelId, messageId));
        } catch (RuntimeException ex) {
            log.warn("Failed to capture message {} for user {} in group {}: {}",
                    messageId, userId, guildId, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Sends a notice to the channel and captures it so it is recalled with the user's messages.
     *
     * @return id of the sent notice, empty when sending failed
     */
    public Optional<String> sendAndCapture(MessagingPlatformClient client,
                                           String userId,
                                           String guildId,
                                           String channelId,
                                           String text) {
        String noticeId;
        try {
            noticeId = client.sendMessage(channelId, text);
        } catch (RuntimeException ex) {
            log.warn("Failed to send notice to channel {} for user {}: {}", channelId, userId, ex.getMessage());
            return Optional.empty();
        }
        capture(userId, guildId, channelId, noticeId);
        return Optional.of(noticeId);
    }

    private CapturedMessage append(String userId, String guildId, String channelId, String messageId) {
        CapturedMessage captured = CapturedMessage.builder()
                .ownerKey(new SessionKey(userId, guildId).ownerKey())
                .id(sequenceAccess.next(LEDGER_SEQUENCE))
                .messageId(messageId)
                .userId(userId)
                .guildId(guildId)
                .channelId(channelId)
                .sentAt(clock.millis())
                .build();
        capturedMessageAccess.save(captured);
        log.debug("Captured message {} (ledger id {}) for {}", messageId, captured.getId(), captured.getOwnerKey());
        return captured;
    }
}
