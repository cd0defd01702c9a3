package com.example.burn.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class BurnPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfiguration.class);

    @Test
    void defaultsApplyWithoutConfiguration() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            BurnProperties properties = context.getBean(BurnProperties.class);

            assertThat(properties.getRecallDelay()).isEqualTo(Duration.ofSeconds(5));
            assertThat(properties.getMaxDuration()).isEqualTo(Duration.ofSeconds(3600));
            assertThat(properties.getMaxUsers()).isEqualTo(10);
            assertThat(properties.getBatchRecallInterval()).isEqualTo(Duration.ofSeconds(1));
            assertThat(properties.getPlatform().getMode()).isEqualTo(BurnProperties.Platform.Mode.LOCAL);
            assertThat(properties.getRecovery().isEnabled()).isTrue();
            assertThat(properties.getCapture().getPoolSize()).isEqualTo(2);
            assertThat(properties.getCapture().getQueueCapacity()).isEqualTo(1000);
        });
    }

    @Test
    void bareNumbersBindAsSeconds() {
        contextRunner
                .withPropertyValues(
                        "burn.recall-delay=10",
                        "burn.max-duration=600",
                        "burn.batch-recall-interval=250ms",
                        "burn.max-users=3")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    BurnProperties properties = context.getBean(BurnProperties.class);

                    assertThat(properties.getRecallDelay()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(properties.getMaxDuration()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(properties.getBatchRecallInterval()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.getMaxUsers()).isEqualTo(3);
                });
    }

    @Test
    void bindsOneBotConnectionsAndNotices() {
        contextRunner
                .withPropertyValues(
                        "burn.platform.mode=onebot",
                        "burn.platform.connections[0].id=10001",
                        "burn.platform.connections[0].base-url=http://localhost:5700",
                        "burn.platform.connections[0].access-token=secret",
                        "burn.platform.connections[0].timeout=3",
                        "burn.platform.connections[1].id=backup",
                        "burn.platform.connections[1].self-id=10002",
                        "burn.notices.completed=Done.")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    BurnProperties properties = context.getBean(BurnProperties.class);

                    assertThat(properties.getPlatform().getMode()).isEqualTo(BurnProperties.Platform.Mode.ONEBOT);
                    BurnProperties.Connection connection = properties.getPlatform().getConnections().get(0);
                    assertThat(connection.getId()).isEqualTo("10001");
                    assertThat(connection.getBaseUrl()).isEqualTo("http://localhost:5700");
                    assertThat(connection.getAccessToken()).isEqualTo("secret");
                    assertThat(connection.getTimeout()).isEqualTo(Duration.ofSeconds(3));
                    assertThat(connection.effectiveSelfId()).isEqualTo("10001");
                    assertThat(properties.getPlatform().getConnections().get(1).effectiveSelfId()).isEqualTo("10002");
                    assertThat(properties.getNotices().getCompleted()).isEqualTo("Done.");
                });
    }

    @Test
    void rejectsValuesBelowMinimums() {
        contextRunner.withPropertyValues("burn.recall-delay=500ms")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("burn.max-duration=0")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("burn.batch-recall-interval=50ms")
                .run(context -> assertThat(context).hasFailed());
        contextRunner.withPropertyValues("burn.max-users=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(BurnProperties.class)
    static class TestConfiguration {
    }
}
