package com.pricefresh.freshness;

import java.util.List;

/**
 * Snapshot of the store for diagnostics. Keys are listed least recently used first.
 */
public record CacheStats(int size, List<String> keys) {
}
