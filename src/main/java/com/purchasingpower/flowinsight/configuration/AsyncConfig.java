package com.purchasingpower.flowinsight.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the post-extraction enrichment calls.
 *
 * Two workers: the improvement suggestions and the draft analysis are the
 * only tasks and run side by side.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String ENRICHMENT_EXECUTOR = "enrichmentExecutor";

    @Bean(name = ENRICHMENT_EXECUTOR)
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);

        // Queue capacity - number of tasks to queue before rejecting
        executor.setQueueCapacity(50);

        // Thread name prefix for debugging
        executor.setThreadNamePrefix("enrichment-");

        // Wait for tasks to complete on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Enrichment executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
