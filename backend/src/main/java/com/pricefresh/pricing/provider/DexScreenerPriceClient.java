package com.pricefresh.pricing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.pricefresh.config.CaffeineConfig;
import com.pricefresh.pricing.config.PricingConfig;
import com.pricefresh.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * DexScreener pair prices via GET /tokens/v1/{chain}/{address}. The pair with the deepest USD
 * liquidity wins. Results are cached for a minute; empty answers are not cached.
 */
@Component
@Slf4j
public class DexScreenerPriceClient implements DexPairPriceProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final AsyncCache<String, Optional<Double>> priceCache;

    public DexScreenerPriceClient(
            PricingProperties pricingProperties,
            WebClient.Builder webClientBuilder,
            @Qualifier(PricingConfig.DEXSCREENER_RATE_LIMITER) RateLimiter rateLimiter,
            @Qualifier(CaffeineConfig.DEX_PAIR_PRICE_CACHE) AsyncCache<String, Optional<Double>> priceCache) {
        this.pricingProperties = pricingProperties;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.priceCache = priceCache;
    }

    @Override
    public boolean supportsChain(String chainId) {
        return DexScreenerChainMapper.toChainSlug(chainId).isPresent();
    }

    @Override
    public CompletableFuture<Optional<Double>> priceUsd(String chainId, String tokenAddress) {
        Optional<String> slug = DexScreenerChainMapper.toChainSlug(chainId);
        if (slug.isEmpty() || tokenAddress == null || tokenAddress.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String address = tokenAddress.strip();
        String cacheKey = chainId.strip() + ":" + address.toLowerCase(Locale.ROOT);
        CompletableFuture<Optional<Double>> price = priceCache.get(cacheKey, (k, executor) -> fetch(slug.get(), address));
        return price
                .thenApply(p -> {
                    if (p.isEmpty()) {
                        priceCache.asMap().remove(cacheKey, price);
                    }
                    return p;
                })
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof WebClientResponseException wcre) {
                        log.warn("DexScreener price failed for {} on {}: {}", address, slug.get(), wcre.getStatusCode());
                    } else {
                        log.warn("DexScreener price error for {} on {}: {}", address, slug.get(), cause.toString());
                    }
                    return Optional.empty();
                });
    }

    private CompletableFuture<Optional<Double>> fetch(String chainSlug, String address) {
        if (!rateLimiter.acquirePermission()) {
            log.debug("DexScreener rate limit reached, skipping {}", address);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String url = pricingProperties.getDexscreenerBaseUrl() + "/tokens/v1/" + chainSlug + "/" + address;
        return webClientBuilder.build()
                .get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()))
                .toFuture()
                .thenApply(DexScreenerPriceClient::parseBestPairPrice);
    }

    /**
     * Accepts either a bare array of pairs or an object with a "pairs" array.
     */
    static Optional<Double> parseBestPairPrice(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode pairs = root.isArray() ? root : root.path("pairs");
            if (!pairs.isArray()) {
                return Optional.empty();
            }
            Double best = null;
            double bestLiquidity = Double.NEGATIVE_INFINITY;
            for (JsonNode pair : pairs) {
                double price = parseDouble(pair.path("priceUsd"));
                if (!(price > 0) || Double.isInfinite(price)) {
                    continue;
                }
                double liquidity = parseDouble(pair.path("liquidity").path("usd"));
                if (Double.isNaN(liquidity)) {
                    liquidity = 0;
                }
                if (best == null || liquidity > bestLiquidity) {
                    best = price;
                    bestLiquidity = liquidity;
                }
            }
            return Optional.ofNullable(best);
        } catch (Exception e) {
            log.debug("Unparseable DexScreener response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static double parseDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().strip());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
