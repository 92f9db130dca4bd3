package com.sensor.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Single worker with no queue: at most one training run at a time, never on the
     * scoring threads. A submission while a run is active is rejected.
     */
    @Bean(name = "retrainExecutor")
    public ThreadPoolTaskExecutor retrainExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("retrain-");
        return executor;
    }

    @Bean(name = "alertDispatchExecutor")
    public ThreadPoolTaskExecutor alertDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("alert-dispatch-");
        return executor;
    }
}
