package com.pricefresh.pricing;

import com.pricefresh.domain.PriceSource;

import java.util.concurrent.CompletableFuture;

/**
 * One source in the price resolution chain. Returns UNKNOWN (or fails) when it has no price;
 * the chain moves on to the next source either way.
 */
public interface TokenPriceResolver {

    PriceSource source();

    CompletableFuture<PriceResolutionResult> resolve(PriceRequest request);
}
