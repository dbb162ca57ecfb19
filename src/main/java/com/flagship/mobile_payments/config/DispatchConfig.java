package com.flagship.mobile_payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for gateway dispatch. The dispatch loop submits one
 * batch at a time, so the queue never holds more than one batch.
 */
@Configuration
public class DispatchConfig {

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(@Value("${dispatch.worker.concurrency:4}") int concurrency,
                                                   @Value("${dispatch.worker.batch-size:20}") int batchSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(batchSize);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
