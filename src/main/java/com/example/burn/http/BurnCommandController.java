package com.example.burn.http;

import com.example.burn.config.BurnProperties;
import com.example.burn.models.RetentionSession;
import com.example.burn.requests.BurnCommandHttpRequest;
import com.example.burn.service.SessionLifecycleService;
import com.example.burn.service.SessionLifecycleService.ActivationResult;
import com.example.burn.service.SessionLifecycleService.DeactivationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP adapter for the enable/disable commands. A chat front end forwards the command together
 * with the message context; rejections come back as {@code {code, message}} bodies.
 */
@RestController
public class BurnCommandController {

    private final SessionLifecycleService lifecycleService;
    private final BurnProperties properties;

    public BurnCommandController(SessionLifecycleService lifecycleService, BurnProperties properties) {
        this.lifecycleService = lifecycleService;
        this.properties = properties;
    }

    @PostMapping("/commands/burn/enable")
    public ResponseEntity<SessionResponse> enable(@RequestBody BurnCommandHttpRequest request) {
        ActivationResult result = lifecycleService.activate(request.toActivateRequest());
        RetentionSession session = result.session();
        return ResponseEntity.ok(new SessionResponse(
                "ACTIVATED",
                session.getUserId(),
                session.getGuildId(),
                session.getChannelId(),
                session.getEnabledAt(),
                session.getExpiresAt(),
                properties.getRecallDelay().toSeconds(),
                properties.getMaxDuration().toSeconds(),
                null
        ));
    }

    @PostMapping("/commands/burn/disable")
    public ResponseEntity<SessionResponse> disable(@RequestBody BurnCommandHttpRequest request) {
        DeactivationResult result = lifecycleService.deactivate(request.toDeactivateRequest());
        RetentionSession session = result.session();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SessionResponse(
                "DEACTIVATED",
                session.getUserId(),
                session.getGuildId(),
                session.getChannelId(),
                session.getEnabledAt(),
                session.getExpiresAt(),
                properties.getRecallDelay().toSeconds(),
                null,
                result.timerCancelled()
        ));
    }
}
