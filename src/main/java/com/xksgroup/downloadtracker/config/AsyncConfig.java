package com.xksgroup.downloadtracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Fixed-size pool bounding the number of simultaneous library lookups.
     * Work still queued at shutdown is dropped and running lookups are interrupted.
     */
    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor(
            @Value("${tracker.enrichment.max-concurrent:4}") int maxConcurrent,
            @Value("${tracker.enrichment.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, maxConcurrent));
        executor.setMaxPoolSize(Math.max(1, maxConcurrent));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix("enrich-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
