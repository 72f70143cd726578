package com.pricefresh.pricing.provider;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * External price aggregator keyed by ticker (e.g. "btc", "ETH"); chain-agnostic.
 */
public interface SymbolPriceProvider {

    /**
     * @return USD price for the ticker, or empty when the ticker is unknown to the aggregator
     */
    CompletableFuture<Optional<Double>> priceUsd(String symbol);
}
