package com.pricefresh.pricing.provider;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * External per-pair price provider (DEX pair indexer). Only queried for chains it supports.
 */
public interface DexPairPriceProvider {

    boolean supportsChain(String chainId);

    /**
     * @return USD price of the token's best pair, or empty when the provider has none
     */
    CompletableFuture<Optional<Double>> priceUsd(String chainId, String tokenAddress);
}
