package com.example.hostguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for batch host scans. Fan-out per batch is bounded by
 * host-guard.scan.batch-size; the pool only bounds the threads behind it.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "scanExecutor")
    public Executor scanExecutor(HostGuardProperties properties) {
        HostGuardProperties.ScanConfig scan = properties.getScan();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scan.getExecutorCorePoolSize());
        executor.setMaxPoolSize(scan.getExecutorMaxPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("scan-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
