package com.pricefresh.config;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches in front of the external price providers, so repeated lookups within a minute
 * do not spend rate-limit budget.
 */
@Configuration
public class CaffeineConfig {

    public static final String DEX_PAIR_PRICE_CACHE = "dexPairPriceCache";
    public static final String SYMBOL_PRICE_CACHE = "symbolPriceCache";

    @Bean(name = DEX_PAIR_PRICE_CACHE)
    public AsyncCache<String, Optional<Double>> dexPairPriceCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(2_000)
                .buildAsync();
    }

    @Bean(name = SYMBOL_PRICE_CACHE)
    public AsyncCache<String, Optional<Double>> symbolPriceCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(500)
                .buildAsync();
    }
}
