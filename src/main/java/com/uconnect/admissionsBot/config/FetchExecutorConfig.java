package com.uconnect.admissionsBot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for running independent academic lookups of one plan concurrently.
 */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "academicFetchExecutor")
    public ThreadPoolTaskExecutor academicFetchExecutor(
            @Value("${uconnect.fetch.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("academic-fetch-");
        executor.initialize();
        return executor;
    }
}
