package com.cashcow.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor behind asynchronous entity store queries.
 *
 * <p>The parallel forecast path does not use this executor; it sizes its own worker pool per
 * call.
 */
@Configuration
public class AsyncConfig {

    @Value("${cashcow.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${cashcow.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${cashcow.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("forecastExecutor")
    public ThreadPoolTaskExecutor forecastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("forecast-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
