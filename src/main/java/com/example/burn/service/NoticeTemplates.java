package com.example.burn.service;

import com.example.burn.config.BurnProperties;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders the configured notice texts (burn.notices.*).
 */
@Component
@RequiredArgsConstructor
public class NoticeTemplates {

    private final BurnProperties properties;

    public String activated() {
        return render(properties.getNotices().getActivated(), null);
    }

    public String deactivated() {
        return render(properties.getNotices().getDeactivated(), null);
    }

    public String expired(String userId) {
        return render(properties.getNotices().getExpired(), userId);
    }

    public String completed() {
        return render(properties.getNotices().getCompleted(), null);
    }

    private String render(String template, String userId) {
        return template
                .replace("{recallDelay}", seconds(properties.getRecallDelay()))
                .replace("{maxDuration}", seconds(properties.getMaxDuration()))
                .replace("{userId}", userId == null ? "" : userId);
    }

    static String seconds(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis(), 3).stripTrailingZeros().toPlainString();
    }
}
