package com.reporting.config;

import com.reporting.infrastructure.store.AggregationJobStore;
import com.reporting.infrastructure.store.SchemaRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the in-memory stores and the job worker pool.
 *
 * Pool settings (app.jobs.*):
 * - worker-pool-size: concurrent jobs (default 4)
 * - queue-capacity: pending jobs waiting for a worker (default 100)
 */
@Configuration
public class AggregationConfiguration {

    @Bean
    public SchemaRegistry schemaRegistry() {
        return SchemaRegistry.withDefaults();
    }

    @Bean
    public AggregationJobStore aggregationJobStore() {
        return new AggregationJobStore();
    }

    /**
     * Bounded worker pool for aggregation jobs. Submissions beyond the queue
     * capacity are rejected and the job is failed.
     */
    @Bean(name = "aggregationJobExecutor")
    public ThreadPoolTaskExecutor aggregationJobExecutor(
            @Value("${app.jobs.worker-pool-size:4}") int poolSize,
            @Value("${app.jobs.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("aggregation-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
