package com.washdispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: dispatch-executor evaluates cleaner eligibility in parallel,
 * notification-executor delivers job updates after commit.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String DISPATCH_EXECUTOR = "dispatch-executor";
    public static final String NOTIFICATION_EXECUTOR = "notification-executor";

    @Bean(name = DISPATCH_EXECUTOR)
    public Executor dispatchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("dispatch-");
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(1000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
