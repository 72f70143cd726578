package com.pricefresh.pricing;

import lombok.Builder;
import lombok.Getter;

import java.util.Optional;

/**
 * Inputs for USD price resolution. Known prices are optional hints the caller already holds:
 * an explicit price-API value and a price implied by a swap quote.
 */
@Getter
@Builder(toBuilder = true)
public class PriceRequest {

    private final String chainId;
    private final String tokenAddress;
    private final String symbol;
    private final Double knownApiPrice;
    private final Double knownRouterPrice;

    public static PriceRequest of(String chainId, String tokenAddress, String symbol) {
        return builder().chainId(chainId).tokenAddress(tokenAddress).symbol(symbol).build();
    }

    public Optional<Double> getKnownApiPrice() {
        return Optional.ofNullable(knownApiPrice);
    }

    public Optional<Double> getKnownRouterPrice() {
        return Optional.ofNullable(knownRouterPrice);
    }
}
