package com.hostelgate.backend.global.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for after-commit side effects: in-app notifications and SMS.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

    @Bean(name = DISPATCH_EXECUTOR)
    public Executor dispatchExecutor(
            @Value("${app.dispatch.core-pool-size:2}") int corePoolSize,
            @Value("${app.dispatch.max-pool-size:4}") int maxPoolSize,
            @Value("${app.dispatch.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
