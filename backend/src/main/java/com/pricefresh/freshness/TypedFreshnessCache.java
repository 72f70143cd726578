package com.pricefresh.freshness;

import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * A view of the shared store for one data class: the freshness tier and the payload type are
 * fixed where the view is created, so call sites cannot mix them up.
 */
@RequiredArgsConstructor
public class TypedFreshnessCache<T> {

    private final StaleWhileRevalidateCache swrCache;
    private final FreshnessStore store;
    private final FreshnessTier tier;
    private final Class<T> type;

    public CacheLookup<T> get(String key) {
        CacheLookup<Object> lookup = store.get(key);
        if (lookup.isPresent() && !type.isInstance(lookup.data().get())) {
            throw new ClassCastException("Entry " + key + " holds "
                    + lookup.data().get().getClass().getName() + ", expected " + type.getName());
        }
        return lookup.isPresent()
                ? CacheLookup.present(type.cast(lookup.data().get()), lookup.stale())
                : CacheLookup.absent();
    }

    public CompletableFuture<SwrResult<T>> swr(String key, Fetcher<T> fetcher) {
        return swrCache.swr(key, fetcher, tier.options());
    }

    public CompletableFuture<T> fetchAndCache(String key, Fetcher<T> fetcher) {
        return swrCache.fetchAndCache(key, fetcher, tier.options());
    }

    public void set(String key, T data) {
        store.set(key, type.cast(data), tier.options());
    }

    public void invalidate(String key) {
        store.invalidate(key);
    }

    public FreshnessTier tier() {
        return tier;
    }
}
