package com.example.burn.health;

import com.example.burn.service.ExpirationScheduler;
import java.time.Clock;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final ExpirationScheduler expirationScheduler;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            ExpirationScheduler expirationScheduler,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.expirationScheduler = expirationScheduler;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", clock.instant().toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "burn-after-reading",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "armed_timers", expirationScheduler.armedCount()
        ));
    }
}
