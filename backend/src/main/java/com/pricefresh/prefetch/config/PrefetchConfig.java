package com.pricefresh.prefetch.config;

import com.pricefresh.config.SchedulerConfig;
import com.pricefresh.domain.TokenListEntry;
import com.pricefresh.freshness.CacheKeys;
import com.pricefresh.freshness.Fetcher;
import com.pricefresh.freshness.FreshnessStore;
import com.pricefresh.freshness.FreshnessTier;
import com.pricefresh.freshness.RequestCoalescer;
import com.pricefresh.prefetch.PrefetchPlan;
import com.pricefresh.prefetch.PrefetchScheduler;
import com.pricefresh.tokenlist.TokenListSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Token list prefetch: one token-list key per configured chain, fetched from the token list source.
 */
@Configuration
@EnableConfigurationProperties(PrefetchProperties.class)
public class PrefetchConfig {

    @Bean
    public PrefetchScheduler<List<TokenListEntry>> tokenListPrefetchScheduler(
            FreshnessStore freshnessStore,
            RequestCoalescer requestCoalescer,
            @Qualifier(SchedulerConfig.PREFETCH_SCHEDULER) TaskScheduler prefetchScheduler,
            Clock freshnessClock,
            PrefetchProperties properties,
            TokenListSource tokenListSource) {
        PrefetchPlan plan = new PrefetchPlan(
                properties.getPriorityChains().stream().map(CacheKeys::tokenList).toList(),
                properties.getSecondaryChains().stream().map(CacheKeys::tokenList).toList(),
                Duration.ofMillis(properties.getPriorityDelayMs()),
                Duration.ofMillis(properties.getSecondaryDelayMs()),
                FreshnessTier.TOKEN_LIST.options());
        return new PrefetchScheduler<>(freshnessStore, requestCoalescer, prefetchScheduler, freshnessClock, plan,
                key -> tokenListFetcher(tokenListSource, key));
    }

    static Fetcher<List<TokenListEntry>> tokenListFetcher(TokenListSource tokenListSource, String key) {
        String chainId = CacheKeys.chainOfTokenList(key);
        if (chainId == null) {
            return null;
        }
        return () -> tokenListSource.getTokens(chainId);
    }
}
