package com.pricefresh.config;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.pricefresh.freshness.FreshnessStore;
import com.pricefresh.freshness.StaleWhileRevalidateCache;
import com.pricefresh.freshness.config.FreshnessConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class,
        FreshnessConfig.class
}, properties = "pricefresh.freshness.capacity=50")
class CacheAndExecutorConfigTest {

    @Autowired
    @Qualifier(CaffeineConfig.DEX_PAIR_PRICE_CACHE)
    AsyncCache<String, Optional<Double>> dexPairPriceCache;

    @Autowired
    @Qualifier(CaffeineConfig.SYMBOL_PRICE_CACHE)
    AsyncCache<String, Optional<Double>> symbolPriceCache;

    @Autowired
    @Qualifier(AsyncConfig.REVALIDATION_EXECUTOR)
    Executor revalidationExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.PREFETCH_SCHEDULER)
    ThreadPoolTaskScheduler prefetchScheduler;

    @Autowired
    FreshnessStore freshnessStore;

    @Autowired
    StaleWhileRevalidateCache staleWhileRevalidateCache;

    @Test
    @DisplayName("both provider caches are created and usable")
    void cachesCreatedAndUsed() {
        dexPairPriceCache.synchronous().put("1:0xabc", Optional.of(1.5));
        symbolPriceCache.synchronous().put("bitcoin", Optional.empty());

        assertThat(dexPairPriceCache.synchronous().getIfPresent("1:0xabc")).contains(1.5);
        assertThat(symbolPriceCache.synchronous().getIfPresent("bitcoin")).isEmpty();
    }

    @Test
    @DisplayName("revalidation executor is a bounded pool")
    void revalidationExecutor() {
        assertThat(revalidationExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) revalidationExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(2);
        assertThat(e.getMaxPoolSize()).isEqualTo(2);
        assertThat(e.getQueueCapacity()).isEqualTo(200);
        assertThat(e.getThreadNamePrefix()).isEqualTo("revalidate-");
    }

    @Test
    @DisplayName("prefetch scheduler is created and configured")
    void prefetchSchedulerCreated() {
        assertThat(prefetchScheduler.getThreadNamePrefix()).isEqualTo("prefetch-");
        // Pool size 1 is configured; current pool size may be 0 until tasks run
        assertThat(prefetchScheduler.getPoolSize()).isLessThanOrEqualTo(1);
    }

    @Test
    @DisplayName("freshness store honours the configured capacity and is shared")
    void freshnessStoreCapacity() {
        assertThat(freshnessStore.capacity()).isEqualTo(50);
        assertThat(staleWhileRevalidateCache.store()).isSameAs(freshnessStore);
    }
}
