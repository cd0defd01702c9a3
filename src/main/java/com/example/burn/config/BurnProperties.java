package com.example.burn.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for burn-after-reading sessions.
 * These values are bound from application.yml (burn.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 * Bare numbers are read as seconds, so {@code recall-delay: 5} and {@code recall-delay: 5s} agree.
 */
@Component
@ConfigurationProperties(prefix = "burn")
@Validated
@Data
public class BurnProperties {

    private static final Duration MIN_RECALL_INTERVAL = Duration.ofMillis(100);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration recallDelay = Duration.ofSeconds(5);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxDuration = Duration.ofSeconds(3600);

    @Min(1)
    private int maxUsers = 10;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration batchRecallInterval = Duration.ofSeconds(1);

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Capture capture = new Capture();

    @Valid
    private Recovery recovery = new Recovery();

    @Valid
    private Platform platform = new Platform();

    @Valid
    private Notices notices = new Notices();

    @AssertTrue(message = "recall-delay must be at least 1s")
    public boolean isRecallDelayValid() {
        return recallDelay == null || recallDelay.compareTo(Duration.ofSeconds(1)) >= 0;
    }

    @AssertTrue(message = "max-duration must be at least 1s")
    public boolean isMaxDurationValid() {
        return maxDuration == null || maxDuration.compareTo(Duration.ofSeconds(1)) >= 0;
    }

    @AssertTrue(message = "batch-recall-interval must be at least 100ms")
    public boolean isBatchRecallIntervalValid() {
        return batchRecallInterval == null || batchRecallInterval.compareTo(MIN_RECALL_INTERVAL) >= 0;
    }

    @Data
    public static class Scheduler {
        @Min(1)
        private int poolSize = 4;
    }

    /**
     * Pool that records inbound messages off the webhook thread. Events beyond the queue are
     * dropped and logged.
     */
    @Data
    public static class Capture {
        @Min(1)
        private int poolSize = 2;

        @Min(1)
        private int queueCapacity = 1000;
    }

    @Data
    public static class Recovery {
        // disabled in tests that boot the context without a DynamoDB endpoint
        private boolean enabled = true;
    }

    @Data
    public static class Platform {
        private Mode mode = Mode.LOCAL;

        @Valid
        private List<Connection> connections = new ArrayList<>();

        public enum Mode {
            LOCAL,
            ONEBOT
        }
    }

    @Data
    public static class Connection {
        @NotBlank
        private String id;

        // bot account's user id on the platform, defaults to id
        private String selfId;

        private String baseUrl;

        private String accessToken;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofSeconds(10);

        public String effectiveSelfId() {
            return selfId == null || selfId.isBlank() ? id : selfId;
        }
    }

    /**
     * User-facing notice texts. Placeholders: {userId}, {recallDelay}, {maxDuration}, both
     * durations rendered in whole seconds.
     */
    @Data
    public static class Notices {
        @NotBlank
        private String activated = "Burn after reading is on. Messages sent before you turn it off, "
                + "or within {maxDuration} seconds, will be recalled {recallDelay} seconds later.";

        @NotBlank
        private String deactivated = "Burn after reading is off. Messages will be destroyed in {recallDelay} seconds.";

        @NotBlank
        private String expired = "Burn after reading for user {userId} has expired. "
                + "Messages will be destroyed in {recallDelay} seconds.";

        @NotBlank
        private String completed = "Thanks for using burn after reading.";
    }
}
