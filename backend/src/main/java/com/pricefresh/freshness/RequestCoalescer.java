package com.pricefresh.freshness;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Deduplicates concurrent fetches: at most one fetcher invocation is in flight per key and every
 * caller for that key shares its future.
 */
@RequiredArgsConstructor
@Slf4j
public class RequestCoalescer {

    private final FreshnessStore store;

    public <T> CompletableFuture<T> fetchAndCache(String key, Fetcher<T> fetcher, FreshnessTier tier) {
        return fetchAndCache(key, fetcher, tier.options());
    }

    /**
     * Fetches {@code key} and stores the result, joining an in-flight fetch for the same key when
     * there is one. The returned future completes after the store has been updated and the slot
     * released; it fails with the fetcher's own exception.
     */
    public <T> CompletableFuture<T> fetchAndCache(String key, Fetcher<T> fetcher, FreshnessOptions options) {
        CompletableFuture<T> slot = new CompletableFuture<>();
        CompletableFuture<T> pending = store.putPendingIfAbsent(key, slot);
        if (pending != null) {
            log.trace("Joining in-flight fetch for {}", key);
            return pending;
        }
        CompletableFuture<T> fetch;
        try {
            fetch = fetcher.fetch();
            if (fetch == null) {
                fetch = CompletableFuture.failedFuture(new FetchException("Fetcher for " + key + " returned no future"));
            }
        } catch (Throwable e) {
            // the slot is already registered and must settle, whatever the fetcher threw
            fetch = CompletableFuture.failedFuture(e);
        }
        fetch.whenComplete((value, error) -> {
            Throwable failure = unwrap(error);
            if (failure == null && value == null) {
                failure = new FetchException("Fetcher for " + key + " produced no value");
            }
            try {
                store.settle(key, slot, failure == null ? value : null, options);
            } finally {
                if (failure == null) {
                    slot.complete(value);
                } else {
                    slot.completeExceptionally(failure);
                }
            }
        });
        return slot;
    }

    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
