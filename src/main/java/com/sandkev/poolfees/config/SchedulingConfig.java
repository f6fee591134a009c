package com.sandkev.poolfees.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Two scheduler threads so transaction polling and the daily price refresh never wait on each other.
 * Backfill gets its own single thread so it does not hold a scheduler slot.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
@EnableScheduling
@EnableAsync
public class SchedulingConfig {

    public static final String BACKFILL_EXECUTOR = "backfill-executor";

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("reconcile-");
        // let an in-flight tick finish; periodic tasks are not re-armed after shutdown
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }

    @Bean(name = BACKFILL_EXECUTOR)
    public ThreadPoolTaskExecutor backfillExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("backfill-");
        e.initialize();
        return e;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
