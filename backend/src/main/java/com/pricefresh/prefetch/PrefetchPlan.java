package com.pricefresh.prefetch;

import com.pricefresh.freshness.FreshnessOptions;

import java.time.Duration;
import java.util.List;

/**
 * What to warm and when: priority keys after {@code priorityDelay}, then secondary keys
 * {@code secondaryDelay} after the priority pass has settled.
 */
public record PrefetchPlan(
        List<String> priorityKeys,
        List<String> secondaryKeys,
        Duration priorityDelay,
        Duration secondaryDelay,
        FreshnessOptions options) {

    public PrefetchPlan {
        priorityKeys = List.copyOf(priorityKeys);
        secondaryKeys = List.copyOf(secondaryKeys);
    }
}
