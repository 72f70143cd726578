package com.pricefresh.freshness.config;

import com.pricefresh.config.AsyncConfig;
import com.pricefresh.freshness.FreshnessStore;
import com.pricefresh.freshness.RequestCoalescer;
import com.pricefresh.freshness.StaleWhileRevalidateCache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * One store, coalescer and SWR orchestrator per application session.
 */
@Configuration
@EnableConfigurationProperties(FreshnessProperties.class)
public class FreshnessConfig {

    @Bean
    public Clock freshnessClock() {
        return Clock.systemUTC();
    }

    @Bean
    public FreshnessStore freshnessStore(FreshnessProperties properties, Clock freshnessClock) {
        return new FreshnessStore(properties.getCapacity(), freshnessClock);
    }

    @Bean
    public RequestCoalescer requestCoalescer(FreshnessStore freshnessStore) {
        return new RequestCoalescer(freshnessStore);
    }

    @Bean
    public StaleWhileRevalidateCache staleWhileRevalidateCache(
            FreshnessStore freshnessStore,
            RequestCoalescer requestCoalescer,
            @Qualifier(AsyncConfig.REVALIDATION_EXECUTOR) Executor revalidationExecutor) {
        return new StaleWhileRevalidateCache(freshnessStore, requestCoalescer, revalidationExecutor);
    }
}
