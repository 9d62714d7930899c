package com.vidfeed.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "videoWarmupExecutor")
    public Executor videoWarmupExecutor(VideoManagerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCapacity());  // One warm-up per decoder slot
        executor.setMaxPoolSize(properties.getCapacity());
        executor.setQueueCapacity(properties.getCapacity() * 2); // Room for cancelled warm-ups still unwinding
        executor.setThreadNamePrefix("video-warmup-");
        executor.initialize();
        return executor;
    }

    /**
     * Single thread so listeners see events in the order they were published.
     */
    @Bean(name = "videoEventExecutor")
    public Executor videoEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("video-events-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "videoTaskScheduler")
    public TaskScheduler videoTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);  // Warm-up timeouts and retry timers only
        scheduler.setThreadNamePrefix("video-timer-");
        scheduler.initialize();
        return scheduler;
    }
}
