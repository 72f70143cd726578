package com.pricefresh.freshness;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-owned data source for one cache key. Must not touch the {@link FreshnessStore} itself;
 * timeouts and retries, if any, belong here.
 */
@FunctionalInterface
public interface Fetcher<T> {

    CompletableFuture<T> fetch();
}
