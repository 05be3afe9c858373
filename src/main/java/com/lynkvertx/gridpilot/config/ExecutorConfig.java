package com.lynkvertx.gridpilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the control loop.
 * Device evaluation and device actuation use separate pools so that a hung
 * actuation call cannot starve evaluation of other devices in the same tick.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "evaluationExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor evaluationExecutor(AutopilotProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("autopilot-eval-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "actuationExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor actuationExecutor(AutopilotProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads() * 2);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("device-actuation-");
        executor.initialize();
        return executor;
    }
}
