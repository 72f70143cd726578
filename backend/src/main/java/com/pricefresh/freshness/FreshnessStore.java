package com.pricefresh.freshness;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * In-process freshness store with LRU eviction.
 * <p>
 * Entries, access order and pending-request slots are mutated together under this instance's
 * monitor. Access order is kept by an access-ordered {@link LinkedHashMap}, so a touch and an
 * eviction are both O(1) and the key sets can never diverge.
 */
@Slf4j
public class FreshnessStore {

    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry<?>> entries;
    private final Map<String, CompletableFuture<?>> pendingRequests = new HashMap<>();

    public FreshnessStore(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public FreshnessStore(Clock clock) {
        this(DEFAULT_CAPACITY, clock);
    }

    /**
     * Reads an entry. Expired entries are removed and reported absent; a hit marks the key most
     * recently used.
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> CacheLookup<T> get(String key) {
        CacheEntry<?> entry = entries.get(key);
        if (entry == null) {
            return CacheLookup.absent();
        }
        Instant now = clock.instant();
        if (entry.isExpiredAt(now)) {
            entries.remove(key);
            return CacheLookup.absent();
        }
        return CacheLookup.present((T) entry.data(), entry.isStaleAt(now));
    }

    public <T> void set(String key, T data) {
        set(key, data, FreshnessTier.DEFAULT.options());
    }

    /**
     * Stores {@code data}, overwriting any existing entry. Eviction runs before the insert, so the
     * new key is never the victim.
     */
    public synchronized <T> void set(String key, T data, FreshnessOptions options) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(data, "data is required");
        Objects.requireNonNull(options, "options is required");
        entries.remove(key);
        evictIfNeeded();
        entries.put(key, CacheEntry.of(data, clock.instant(), options));
    }

    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    public synchronized void invalidatePrefix(String prefix) {
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }

    /**
     * Drops every entry and every pending-request slot. In-flight fetches still complete for their
     * own callers.
     */
    public synchronized void clear() {
        entries.clear();
        pendingRequests.clear();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), List.copyOf(entries.keySet()));
    }

    public int capacity() {
        return capacity;
    }

    synchronized int pendingCount() {
        return pendingRequests.size();
    }

    /**
     * Registers {@code slot} for {@code key} unless a slot already exists.
     *
     * @return the existing slot, or null when {@code slot} was registered
     */
    @SuppressWarnings("unchecked")
    synchronized <T> CompletableFuture<T> putPendingIfAbsent(String key, CompletableFuture<T> slot) {
        return (CompletableFuture<T>) pendingRequests.putIfAbsent(key, slot);
    }

    /**
     * Settles a pending slot: stores the value when present, then releases the slot if it is still
     * the registered one.
     */
    synchronized <T> void settle(String key, CompletableFuture<T> slot, T value, FreshnessOptions options) {
        if (value != null) {
            set(key, value, options);
        }
        pendingRequests.remove(key, slot);
    }

    private void evictIfNeeded() {
        Iterator<String> lru = entries.keySet().iterator();
        while (entries.size() >= capacity && lru.hasNext()) {
            String victim = lru.next();
            lru.remove();
            log.trace("Evicted {} at capacity {}", victim, capacity);
        }
    }
}
