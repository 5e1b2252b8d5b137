package com.lorastudio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the executor that drives batch caption runs.
 */
@Configuration
public class AsyncConfig {

    /**
     * Single thread for batch runs. Only one run is active at a time and
     * chunks must be dispatched strictly in order, so the run loop itself is
     * never parallelised; fan-out inside a chunk belongs to the backend.
     */
    @Bean(name = "captionExecutor")
    public ThreadPoolTaskExecutor captionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("captioner-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
