package com.fintech.candlesync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Runs the sync and indicator ticks on their own timers.
 *
 * Two threads, one per scheduler, so a slow tick of one never delays the other.
 * Store access is still serialized by the gate. Disabled with
 * {@code pipeline.scheduling.enabled=false} for tests and one-off tooling.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "pipeline.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("pipeline-tick-");
        scheduler.setErrorHandler(t -> log.error("Uncaught exception escaped a scheduled tick", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }
}
