package com.pricefresh.freshness;

/**
 * Value returned by a stale-while-revalidate read.
 *
 * @param data      the payload, never null
 * @param fromCache true when served from the store (fresh or stale), false when just fetched
 */
public record SwrResult<T>(T data, boolean fromCache) {
}
