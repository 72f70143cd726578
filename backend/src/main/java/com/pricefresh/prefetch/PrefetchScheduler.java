package com.pricefresh.prefetch;

import com.pricefresh.freshness.Fetcher;
import com.pricefresh.freshness.FreshnessStore;
import com.pricefresh.freshness.RequestCoalescer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Warms the freshness store for a fixed set of keys in two tiers, deferred so it does not compete
 * with start-up work. All warming is best effort: failures are logged, never surfaced.
 *
 * @param <T> payload type of the warmed keys
 */
@Slf4j
public class PrefetchScheduler<T> {

    private final FreshnessStore store;
    private final RequestCoalescer coalescer;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final PrefetchPlan plan;
    private final Function<String, Fetcher<T>> fetcherForKey;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean complete;

    public PrefetchScheduler(
            FreshnessStore store,
            RequestCoalescer coalescer,
            TaskScheduler taskScheduler,
            Clock clock,
            PrefetchPlan plan,
            Function<String, Fetcher<T>> fetcherForKey) {
        this.store = store;
        this.coalescer = coalescer;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.plan = plan;
        this.fetcherForKey = fetcherForKey;
    }

    /**
     * Schedules the priority pass. Calling again has no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.debug("[prefetch] {} priority keys in {}, {} secondary keys after",
                plan.priorityKeys().size(), plan.priorityDelay(), plan.secondaryKeys().size());
        scheduleAfter(this::runPriorityPass, plan.priorityDelay(), "priority");
    }

    /**
     * Fire-and-forget warming of one key, e.g. when a user hovers a chain selector.
     */
    public void prefetch(String key) {
        warmKey(key);
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isComplete() {
        return complete;
    }

    private void runPriorityPass() {
        warm(plan.priorityKeys()).whenComplete((ignored, error) ->
                scheduleAfter(this::runSecondaryPass, plan.secondaryDelay(), "secondary"));
    }

    private void runSecondaryPass() {
        warm(plan.secondaryKeys()).whenComplete((ignored, error) -> {
            complete = true;
            log.debug("[prefetch] All keys prefetched");
        });
    }

    private void scheduleAfter(Runnable pass, Duration delay, String name) {
        try {
            taskScheduler.schedule(pass, clock.instant().plus(delay));
        } catch (TaskRejectedException e) {
            log.debug("[prefetch] {} pass not scheduled: {}", name, e.getMessage());
        }
    }

    CompletableFuture<Void> warm(List<String> keys) {
        return CompletableFuture.allOf(keys.stream()
                .map(this::warmKey)
                .toArray(CompletableFuture[]::new));
    }

    private CompletableFuture<Void> warmKey(String key) {
        if (store.get(key).isPresent()) {
            log.debug("[prefetch] {} already cached", key);
            return CompletableFuture.completedFuture(null);
        }
        Fetcher<T> fetcher;
        try {
            fetcher = fetcherForKey.apply(key);
        } catch (RuntimeException e) {
            log.debug("[prefetch] No fetcher for {}: {}", key, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        if (fetcher == null) {
            log.debug("[prefetch] No fetcher for {}", key);
            return CompletableFuture.completedFuture(null);
        }
        return coalescer.fetchAndCache(key, fetcher, plan.options())
                .handle((value, error) -> {
                    if (error != null) {
                        log.debug("[prefetch] Failed to prefetch {}: {}", key, error.getMessage());
                    } else {
                        log.debug("[prefetch] Prefetched {}", key);
                    }
                    return null;
                });
    }
}
