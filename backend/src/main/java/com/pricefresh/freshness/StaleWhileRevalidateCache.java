package com.pricefresh.freshness;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Stale-while-revalidate reads over a {@link FreshnessStore}.
 * <ul>
 *     <li>fresh hit: served from the store, no fetch;</li>
 *     <li>stale hit: served from the store, revalidated on {@code revalidationExecutor};</li>
 *     <li>miss: fetched (coalesced), failures reach the caller.</li>
 * </ul>
 */
@Slf4j
public class StaleWhileRevalidateCache {

    private final FreshnessStore store;
    private final RequestCoalescer coalescer;
    private final Executor revalidationExecutor;

    public StaleWhileRevalidateCache(FreshnessStore store, RequestCoalescer coalescer, Executor revalidationExecutor) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.coalescer = Objects.requireNonNull(coalescer, "coalescer is required");
        this.revalidationExecutor = Objects.requireNonNull(revalidationExecutor, "revalidationExecutor is required");
    }

    public <T> CompletableFuture<SwrResult<T>> swr(String key, Fetcher<T> fetcher, FreshnessTier tier) {
        return swr(key, fetcher, tier.options());
    }

    public <T> CompletableFuture<SwrResult<T>> swr(String key, Fetcher<T> fetcher, FreshnessOptions options) {
        CacheLookup<T> cached = store.get(key);
        if (cached.isPresent()) {
            if (cached.stale()) {
                revalidateInBackground(key, fetcher, options);
            }
            return CompletableFuture.completedFuture(new SwrResult<>(cached.data().get(), true));
        }
        return coalescer.fetchAndCache(key, fetcher, options)
                .thenApply(data -> new SwrResult<>(data, false));
    }

    public <T> CompletableFuture<T> fetchAndCache(String key, Fetcher<T> fetcher, FreshnessOptions options) {
        return coalescer.fetchAndCache(key, fetcher, options);
    }

    /**
     * Typed view with the tier fixed, for one class of payload.
     */
    public <T> TypedFreshnessCache<T> forTier(FreshnessTier tier, Class<T> type) {
        return new TypedFreshnessCache<>(this, store, tier, type);
    }

    public FreshnessStore store() {
        return store;
    }

    /**
     * Submits a revalidation whose outcome only ever reaches the store. Failures are logged and
     * dropped: the caller already has stale data.
     */
    private <T> void revalidateInBackground(String key, Fetcher<T> fetcher, FreshnessOptions options) {
        try {
            revalidationExecutor.execute(() -> coalescer.fetchAndCache(key, fetcher, options)
                    .whenComplete((value, error) -> {
                        if (error != null) {
                            log.debug("Cache revalidation failed for key: {}", key, RequestCoalescer.unwrap(error));
                        }
                    }));
        } catch (RejectedExecutionException e) {
            log.debug("Cache revalidation for key {} rejected: {}", key, e.getMessage());
        }
    }
}
