package com.pricefresh.pricing.config;

import com.pricefresh.pricing.TokenPriceResolverChain;
import com.pricefresh.pricing.resolver.DexPairPriceResolver;
import com.pricefresh.pricing.resolver.ExplicitApiPriceResolver;
import com.pricefresh.pricing.resolver.RouterQuotePriceResolver;
import com.pricefresh.pricing.resolver.StablecoinRegistryResolver;
import com.pricefresh.pricing.resolver.StablecoinSymbolResolver;
import com.pricefresh.pricing.resolver.SymbolAggregatorPriceResolver;
import com.pricefresh.pricing.resolver.WrappedAssetPriceResolver;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Pricing module configuration: properties, provider rate limiters and the resolver chain order.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String DEXSCREENER_RATE_LIMITER = "dexscreenerRateLimiter";
    public static final String DEFILLAMA_RATE_LIMITER = "defillamaRateLimiter";

    @Bean(name = DEXSCREENER_RATE_LIMITER)
    public RateLimiter dexscreenerRateLimiter(PricingProperties pricingProperties) {
        return perMinute("dexscreener", pricingProperties.getDexscreenerRequestsPerMinute());
    }

    @Bean(name = DEFILLAMA_RATE_LIMITER)
    public RateLimiter defillamaRateLimiter(PricingProperties pricingProperties) {
        return perMinute("defillama", pricingProperties.getDefillamaRequestsPerMinute());
    }

    /**
     * Trust contextual data first, exact address matches before ticker heuristics, and "$1 by
     * convention" only after real price discovery.
     */
    @Bean
    public TokenPriceResolverChain tokenPriceResolverChain(
            ExplicitApiPriceResolver explicitApi,
            RouterQuotePriceResolver routerQuote,
            StablecoinRegistryResolver stablecoinRegistry,
            DexPairPriceResolver dexPair,
            SymbolAggregatorPriceResolver symbolAggregator,
            WrappedAssetPriceResolver wrappedAsset,
            StablecoinSymbolResolver stablecoinSymbol) {
        return new TokenPriceResolverChain(List.of(
                explicitApi,
                routerQuote,
                stablecoinRegistry,
                dexPair,
                symbolAggregator,
                wrappedAsset,
                stablecoinSymbol));
    }

    private static RateLimiter perMinute(String name, int permitsPerMinute) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, permitsPerMinute))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of(name, config);
    }
}
