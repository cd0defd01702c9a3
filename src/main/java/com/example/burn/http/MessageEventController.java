package com.example.burn.http;

import com.example.burn.config.SchedulingConfig;
import com.example.burn.requests.InboundMessage;
import com.example.burn.requests.MessageEventHttpRequest;
import com.example.burn.service.MessageCaptureService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives every message event. Always accepted: capture runs on the capture pool and its
 * failures are the service's to log.
 */
@RestController
@Slf4j
public class MessageEventController {

    private final MessageCaptureService captureService;
    private final TaskExecutor captureExecutor;

    public MessageEventController(MessageCaptureService captureService,
                                  @Qualifier(SchedulingConfig.CAPTURE_EXECUTOR) TaskExecutor captureExecutor) {
        this.captureService = captureService;
        this.captureExecutor = captureExecutor;
    }

    @PostMapping("/events/messages")
    public ResponseEntity<Void> onMessage(@RequestBody MessageEventHttpRequest request) {
        InboundMessage message = request.toInboundMessage();
        try {
            captureExecutor.execute(() -> captureService.onInboundMessage(message));
        } catch (TaskRejectedException ex) {
            log.warn("Capture queue full, dropped message {} from user {}: {}",
                    message.messageId(), message.userId(), ex.getMessage());
        }
        return ResponseEntity.accepted().build();
    }
}
