package com.example.burn.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timers, burns and message capture run on separate pools. Timers only hand work off, burns
 * sleep for most of their lifetime and get a thread each, captures are short store writes.
 */
@Configuration
public class SchedulingConfig {

    public static final String BURN_EXECUTOR = "burnTaskExecutor";
    public static final String CAPTURE_EXECUTOR = "captureTaskExecutor";

    @Bean
    public ThreadPoolTaskScheduler expirationTaskScheduler(BurnProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("expiry-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(name = BURN_EXECUTOR)
    public TaskExecutor burnTaskExecutor() {
        return new SimpleAsyncTaskExecutor("burn-");
    }

    @Bean(name = CAPTURE_EXECUTOR)
    public ThreadPoolTaskExecutor captureTaskExecutor(BurnProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCapture().getPoolSize());
        executor.setMaxPoolSize(properties.getCapture().getPoolSize());
        executor.setQueueCapacity(properties.getCapture().getQueueCapacity());
        executor.setThreadNamePrefix("capture-");
        return executor;
    }
}
