package com.poolradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Batch executor: direct hand-off, so every dispatched target gets its own thread and concurrency is
 * capped by the dispatcher's semaphore rather than by the pool.
 */
@Configuration(proxyBeanMethods = false)
public class AsyncConfig {

    public static final String BATCH_EXECUTOR = "batch-executor";

    @Bean(name = BATCH_EXECUTOR)
    public Executor batchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(256);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setThreadNamePrefix("batch-");
        e.initialize();
        return e;
    }
}
