package com.bank.bakeoff.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /** Runs queued bake-offs; each task carries only a bake-off id. */
    @Bean(name = "bakeoffExecutor")
    public ThreadPoolTaskExecutor bakeoffExecutor(BakeoffConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("bakeoff-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /** Hosts individual candidate training so it can be bounded by the training timeout. */
    @Bean(name = "trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor(BakeoffConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize() + 2);
        executor.setMaxPoolSize(config.getWorkerPoolSize() + 2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("train-");
        executor.initialize();
        return executor;
    }
}
