package com.example.delivery.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Scheduling for the compensation poller, the executor that runs compensation right after a
 * cancellation commits, and the executor that finishes a completion once the capture returns.
 */
@Configuration
@EnableScheduling
@EnableAsync
public class AsyncConfig {

    @Bean(name = "compensationExecutor")
    public ThreadPoolTaskExecutor compensationExecutor(
            @Value("${delivery.compensation.executor.core-size:2}") int coreSize,
            @Value("${delivery.compensation.executor.max-size:4}") int maxSize,
            @Value("${delivery.compensation.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("compensation-");
        // tasks still PENDING after shutdown are picked up by the poller on the next start,
        // tasks left PROCESSING are failed once their claim lease runs out and then retried
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(25);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the store writes and fan-out that follow a capture, off the HTTP client's event loop.
     */
    @Bean(name = "completionExecutor")
    public ThreadPoolTaskExecutor completionExecutor(
            @Value("${delivery.completion.executor.core-size:2}") int coreSize,
            @Value("${delivery.completion.executor.max-size:8}") int maxSize,
            @Value("${delivery.completion.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("completion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(25);
        executor.initialize();
        return executor;
    }
}
