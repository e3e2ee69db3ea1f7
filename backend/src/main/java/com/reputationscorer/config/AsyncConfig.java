package com.reputationscorer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The stream processor gets exactly one thread so messages are scored in delivery order.
 */
@Configuration
public class AsyncConfig {

    public static final String STREAM_PROCESSOR_EXECUTOR = "stream-processor-executor";

    @Bean(name = STREAM_PROCESSOR_EXECUTOR)
    public Executor streamProcessorExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1);
        e.setThreadNamePrefix("stream-processor-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
