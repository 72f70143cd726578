package com.pricefresh.pricing;

import java.util.concurrent.CompletableFuture;

/**
 * A source answering from data already at hand, without I/O. Only these run in
 * {@link TokenPriceResolverChain#resolveSync(PriceRequest)}.
 */
public interface SyncTokenPriceResolver extends TokenPriceResolver {

    PriceResolutionResult resolveNow(PriceRequest request);

    @Override
    default CompletableFuture<PriceResolutionResult> resolve(PriceRequest request) {
        return CompletableFuture.completedFuture(resolveNow(request));
    }
}
