package com.pricefresh.pricing.resolver;

import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.TokenPriceResolver;
import com.pricefresh.pricing.provider.SymbolPriceProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Aggregator price by ticker; covers major assets regardless of chain.
 */
@Component
@RequiredArgsConstructor
public class SymbolAggregatorPriceResolver implements TokenPriceResolver {

    private final SymbolPriceProvider symbolPriceProvider;

    @Override
    public PriceSource source() {
        return PriceSource.SYMBOL_AGGREGATOR;
    }

    @Override
    public CompletableFuture<PriceResolutionResult> resolve(PriceRequest request) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        return symbolPriceProvider.priceUsd(request.getSymbol())
                .thenApply(price -> price
                        .map(p -> PriceResolutionResult.known(p, PriceSource.SYMBOL_AGGREGATOR))
                        .orElse(PriceResolutionResult.unknown()));
    }
}
