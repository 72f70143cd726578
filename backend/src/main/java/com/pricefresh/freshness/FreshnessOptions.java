package com.pricefresh.freshness;

import java.time.Duration;
import java.util.Objects;

/**
 * TTL pair for one cache entry: after {@code staleTime} the entry is served but revalidated,
 * after {@code maxAge} it is gone.
 */
public record FreshnessOptions(Duration staleTime, Duration maxAge) {

    public FreshnessOptions {
        Objects.requireNonNull(staleTime, "staleTime is required");
        Objects.requireNonNull(maxAge, "maxAge is required");
        if (staleTime.isNegative() || maxAge.isNegative()) {
            throw new IllegalArgumentException("staleTime and maxAge must not be negative");
        }
        if (staleTime.compareTo(maxAge) > 0) {
            throw new IllegalArgumentException("staleTime " + staleTime + " exceeds maxAge " + maxAge);
        }
    }

    public static FreshnessOptions of(Duration staleTime, Duration maxAge) {
        return new FreshnessOptions(staleTime, maxAge);
    }
}
