package com.agenttracker.discovery.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;

@Configuration
@EnableScheduling
@Slf4j
public class AsyncConfig {

    @Value("${async.search.core-pool-size:2}")
    private int corePoolSize;

    @Value("${async.search.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${async.search.queue-capacity:50}")
    private int queueCapacity;

    /**
     * Executor for search runs, one thread per run
     */
    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("search-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        // saturated: the rejection surfaces as a failed run
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn("Search run rejected: active={}, queued={}", pool.getActiveCount(), pool.getQueue().size());
            throw new RejectedExecutionException("Search executor is saturated");
        });
        executor.initialize();
        return executor;
    }
}
