package com.nevis.dossier.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private final IngestionProperties ingestionProperties;

    /**
     * One coordinator run per submitted batch. A full queue throws {@code TaskRejectedException},
     * which {@code BatchEventListener} turns into a failed batch.
     */
    @Bean(name = "batchTaskExecutor")
    public Executor batchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(ingestionProperties.batchQueueCapacity());
        executor.setThreadNamePrefix("batch-");
        executor.initialize();
        return executor;
    }

    /**
     * Network-bound work: blob downloads and inference calls.
     */
    @Bean(name = "documentTaskExecutor")
    public Executor documentTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("doc-");
        executor.setConcurrencyLimit(ingestionProperties.maxConcurrentDocuments());
        return executor;
    }

    /**
     * CPU-bound PDF parsing, kept off the network threads.
     */
    @Bean(name = "preparationExecutor")
    public Executor preparationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestionProperties.preparationThreads());
        executor.setMaxPoolSize(ingestionProperties.preparationThreads());
        executor.setThreadNamePrefix("prepare-");
        executor.initialize();
        return executor;
    }
}
