package com.collectvoice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class ExecutorConfig {

    @Bean(name = "callScheduler", destroyMethod = "shutdownNow")
    ScheduledExecutorService callScheduler() {
        return Executors.newScheduledThreadPool(4, new CustomizableThreadFactory("call-scheduler-"));
    }

    @Bean(name = "captureExecutor", destroyMethod = "shutdownNow")
    ExecutorService captureExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("audio-capture-"));
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
