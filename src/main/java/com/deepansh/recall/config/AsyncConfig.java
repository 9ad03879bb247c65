package com.deepansh.recall.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Dedicated thread pools, isolated from the web thread pool.
 *
 * memoryTaskExecutor: compaction and extraction. Bounded queue with abort policy,
 * so saturation surfaces as a REJECTED task event instead of unbounded growth.
 *
 * traceTaskExecutor: trace persistence. Drops the oldest queued trace when full;
 * losing a trace is preferable to blocking a pipeline.
 *
 * retrievalExecutor: semantic stage of retrieval, which runs under a hard deadline.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "memoryTaskExecutor")
    public Executor memoryTaskExecutor(MemoryProperties properties) {
        MemoryProperties.Executor sizing = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sizing.getCorePoolSize());
        executor.setMaxPoolSize(sizing.getMaxPoolSize());
        executor.setQueueCapacity(sizing.getQueueCapacity());
        executor.setThreadNamePrefix("memory-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "traceTaskExecutor")
    public Executor traceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("trace-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "retrievalExecutor")
    public Executor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("retrieval-");
        executor.initialize();
        return executor;
    }
}
