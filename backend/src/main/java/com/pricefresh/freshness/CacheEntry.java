package com.pricefresh.freshness;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A resident value with its freshness timestamps.
 *
 * @param data      cached payload
 * @param createdAt when the payload was stored
 * @param staleAt   after this instant the payload is stale
 * @param expiresAt after this instant the payload must not be served
 */
record CacheEntry<T>(T data, Instant createdAt, Instant staleAt, Instant expiresAt) {

    CacheEntry {
        requireNonNull(data, "data is required and null.");
        if (staleAt.isAfter(expiresAt)) {
            throw new IllegalArgumentException("staleAt must not be after expiresAt");
        }
    }

    static <T> CacheEntry<T> of(T data, Instant now, FreshnessOptions options) {
        return new CacheEntry<>(data, now, now.plus(options.staleTime()), now.plus(options.maxAge()));
    }

    boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    boolean isStaleAt(Instant now) {
        return now.isAfter(staleAt);
    }
}
