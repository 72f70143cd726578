package com.pricefresh.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: revalidation-executor runs fire-and-forget refreshes of stale entries.
 * A full queue rejects the refresh; the stale entry keeps being served.
 */
@Configuration
public class AsyncConfig {

    public static final String REVALIDATION_EXECUTOR = "revalidation-executor";

    @Bean(name = REVALIDATION_EXECUTOR)
    public Executor revalidationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("revalidate-");
        e.initialize();
        return e;
    }
}
