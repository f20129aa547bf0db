package com.washdispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for @Scheduled jobs: the sweeps and the websocket heartbeat.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    // resolved by name by @Scheduled when other TaskScheduler beans exist (websocket support registers one)
    public static final String SCHEDULER_POOL = "taskScheduler";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("sweeper-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.initialize();
        return s;
    }
}
