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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * DefiLlama current prices by ticker via GET /prices/current/coingecko:{id}. Tickers without a
 * CoinGecko id mapping are answered empty without a request.
 */
@Component
@Slf4j
public class DefiLlamaPriceClient implements SymbolPriceProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final AsyncCache<String, Optional<Double>> priceCache;

    public DefiLlamaPriceClient(
            PricingProperties pricingProperties,
            WebClient.Builder webClientBuilder,
            @Qualifier(PricingConfig.DEFILLAMA_RATE_LIMITER) RateLimiter rateLimiter,
            @Qualifier(CaffeineConfig.SYMBOL_PRICE_CACHE) AsyncCache<String, Optional<Double>> priceCache) {
        this.pricingProperties = pricingProperties;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.priceCache = priceCache;
    }

    @Override
    public CompletableFuture<Optional<Double>> priceUsd(String symbol) {
        Optional<String> coinId = TickerToCoinGeckoIdMapper.toCoinGeckoId(symbol);
        if (coinId.isEmpty()) {
            log.debug("No CoinGecko id for ticker {}", symbol);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String id = coinId.get();
        CompletableFuture<Optional<Double>> price = priceCache.get(id, (k, executor) -> fetch(id));
        return price
                .thenApply(p -> {
                    if (p.isEmpty()) {
                        priceCache.asMap().remove(id, price);
                    }
                    return p;
                })
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof WebClientResponseException wcre) {
                        log.warn("DefiLlama price failed for {}: {}", id, wcre.getStatusCode());
                    } else {
                        log.warn("DefiLlama price error for {}: {}", id, cause.toString());
                    }
                    return Optional.empty();
                });
    }

    private CompletableFuture<Optional<Double>> fetch(String coinId) {
        if (!rateLimiter.acquirePermission()) {
            log.debug("DefiLlama rate limit reached, skipping {}", coinId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String url = pricingProperties.getDefillamaBaseUrl() + "/prices/current/coingecko:" + coinId;
        return webClientBuilder.build()
                .get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()))
                .toFuture()
                .thenApply(body -> parseUsdPrice(body, coinId));
    }

    static Optional<Double> parseUsdPrice(String json, String coinId) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = MAPPER.readTree(json);
            JsonNode price = root.path("coins").path("coingecko:" + coinId).path("price");
            if (price.isMissingNode() || !price.isNumber()) {
                return Optional.empty();
            }
            double value = price.doubleValue();
            return value > 0 && !Double.isInfinite(value) ? Optional.of(value) : Optional.empty();
        } catch (Exception e) {
            log.debug("Unparseable DefiLlama response for {}: {}", coinId, e.getMessage());
            return Optional.empty();
        }
    }
}
