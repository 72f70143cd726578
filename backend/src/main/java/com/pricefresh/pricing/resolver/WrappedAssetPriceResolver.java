package com.pricefresh.pricing.resolver;

import com.pricefresh.common.WrappedAssetRegistry;
import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.TokenPriceResolver;
import com.pricefresh.pricing.provider.SymbolPriceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Prices a known wrapper (e.g. XBTC on X Layer) at the aggregator price of the asset it wraps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WrappedAssetPriceResolver implements TokenPriceResolver {

    private final WrappedAssetRegistry wrappedAssetRegistry;
    private final SymbolPriceProvider symbolPriceProvider;

    @Override
    public PriceSource source() {
        return PriceSource.WRAPPED_UNDERLYING;
    }

    @Override
    public CompletableFuture<PriceResolutionResult> resolve(PriceRequest request) {
        Optional<String> underlying = wrappedAssetRegistry.underlyingTicker(request.getChainId(), request.getTokenAddress());
        if (underlying.isEmpty()) {
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        log.debug("Resolving wrapped {} via underlying {}", request.getTokenAddress(), underlying.get());
        return symbolPriceProvider.priceUsd(underlying.get())
                .thenApply(price -> price
                        .map(p -> PriceResolutionResult.known(p, PriceSource.WRAPPED_UNDERLYING))
                        .orElse(PriceResolutionResult.unknown()));
    }
}
