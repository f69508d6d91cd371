package com.deepansh.tracer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for writing completed run trees.
 *
 * Keeps slow storage off the threads that report run notifications.
 * Shutdown waits for queued trees so completed traces are not dropped.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "persistenceTaskExecutor")
    public Executor persistenceTaskExecutor(TracerProperties properties) {
        TracerProperties.Persistence pool = properties.getPersistence();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("run-persist-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(pool.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
