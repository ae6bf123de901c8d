package com.example.dbmonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for schema metadata fan-out, the startup snapshot and streamed assistant answers.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "schemaExecutor")
    public Executor schemaExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(5);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("schema-");
        executor.initialize();
        return executor;
    }

    // Separate from schemaExecutor: the snapshot it runs blocks on metadata reads submitted there
    @Bean(name = "startupExecutor")
    public Executor startupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("startup-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "assistantExecutor")
    public Executor assistantExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("assistant-");
        executor.initialize();
        return executor;
    }
}
