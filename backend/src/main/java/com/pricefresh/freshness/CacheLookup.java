package com.pricefresh.freshness;

import java.util.Optional;

/**
 * Result of {@link FreshnessStore#get(String)}. An absent lookup is both stale and expired;
 * a present one is never expired.
 */
public record CacheLookup<T>(Optional<T> data, boolean stale, boolean expired) {

    private static final CacheLookup<?> ABSENT = new CacheLookup<>(Optional.empty(), true, true);

    @SuppressWarnings("unchecked")
    public static <T> CacheLookup<T> absent() {
        return (CacheLookup<T>) ABSENT;
    }

    public static <T> CacheLookup<T> present(T data, boolean stale) {
        return new CacheLookup<>(Optional.of(data), stale, false);
    }

    public boolean isPresent() {
        return data.isPresent();
    }

    public boolean isFresh() {
        return data.isPresent() && !stale;
    }
}
