package com.pricefresh.pricing;

import java.util.Optional;

/**
 * Unit prices of both legs as quoted by a swap router.
 */
public record RouterPrices(Optional<Double> fromTokenPrice, Optional<Double> toTokenPrice) {

    private static final RouterPrices NONE = new RouterPrices(Optional.empty(), Optional.empty());

    public static RouterPrices none() {
        return NONE;
    }
}
