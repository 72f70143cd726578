package com.pricefresh.pricing.resolver;

import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.TokenPriceResolver;
import com.pricefresh.pricing.provider.DexPairPriceProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Price of the token's most liquid DEX pair. Skipped on chains the provider does not index.
 */
@Component
@RequiredArgsConstructor
public class DexPairPriceResolver implements TokenPriceResolver {

    private final DexPairPriceProvider dexPairPriceProvider;

    @Override
    public PriceSource source() {
        return PriceSource.DEX_PAIR;
    }

    @Override
    public CompletableFuture<PriceResolutionResult> resolve(PriceRequest request) {
        if (request.getTokenAddress() == null || request.getTokenAddress().isBlank()
                || !dexPairPriceProvider.supportsChain(request.getChainId())) {
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        return dexPairPriceProvider.priceUsd(request.getChainId(), request.getTokenAddress())
                .thenApply(price -> price
                        .map(p -> PriceResolutionResult.known(p, PriceSource.DEX_PAIR))
                        .orElse(PriceResolutionResult.unknown()));
    }
}
