package com.apex.guardian.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ExecutionProperties executionProperties;

    /**
     * One task per account is submitted here by the coordinator, so the pool must be able to
     * run every configured account of a strategy at once.
     */
    @Bean(name = "tradingExecutor")
    public Executor tradingExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = Math.max(executionProperties.getMaxParallelAccounts(), processors);
        int maxPoolSize = Math.max(corePoolSize, processors * 4);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("trading-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Runs individual exchange calls so that the caller can stop waiting after the call timeout.
     */
    @Bean(name = "exchangeIoExecutor")
    public ThreadPoolTaskExecutor exchangeIoExecutor() {
        int poolSize = Math.max(executionProperties.getMaxParallelAccounts() * 2, 4);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("exchange-io-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
