package com.example.burn.http;

import com.example.burn.service.BurnException;
import com.example.burn.service.SessionLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SessionController {

    private final SessionLifecycleService lifecycleService;

    public SessionController(SessionLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @GetMapping("/sessions/{userId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String userId) {
        return lifecycleService.findActiveSession(userId)
                .map(session -> ResponseEntity.ok(new SessionResponse(
                        "ACTIVE",
                        session.getUserId(),
                        session.getGuildId(),
                        session.getChannelId(),
                        session.getEnabledAt(),
                        session.getExpiresAt(),
                        null,
                        null,
                        null)))
                .orElseThrow(BurnException::notActive);
    }
}
