package com.pricefresh.freshness;

import java.time.Duration;

/**
 * Named TTL tiers, one per class of data with similar volatility.
 */
public enum FreshnessTier {

    /** Token lists change rarely. */
    TOKEN_LIST(Duration.ofMinutes(5), Duration.ofMinutes(30)),
    PRICE(Duration.ofSeconds(10), Duration.ofSeconds(60)),
    /** Quotes go out of date fastest. */
    QUOTE(Duration.ofSeconds(5), Duration.ofSeconds(30)),
    TOKEN_INFO(Duration.ofMinutes(10), Duration.ofMinutes(60)),
    BALANCE(Duration.ofSeconds(15), Duration.ofMinutes(2)),
    DEFAULT(Duration.ofSeconds(30), Duration.ofMinutes(5));

    private final FreshnessOptions options;

    FreshnessTier(Duration staleTime, Duration maxAge) {
        this.options = new FreshnessOptions(staleTime, maxAge);
    }

    public FreshnessOptions options() {
        return options;
    }
}
