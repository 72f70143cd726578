package com.pricefresh.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool (1 thread) for the deferred prefetch passes.
 */
@Configuration
public class SchedulerConfig {

    public static final String PREFETCH_SCHEDULER = "prefetch-scheduler";

    @Bean(name = PREFETCH_SCHEDULER)
    public ThreadPoolTaskScheduler prefetchScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("prefetch-");
        s.initialize();
        return s;
    }
}
