package com.pricefresh.prefetch;

import com.pricefresh.freshness.CacheKeys;
import com.pricefresh.freshness.FetchException;
import com.pricefresh.freshness.Fetcher;
import com.pricefresh.freshness.FreshnessStore;
import com.pricefresh.freshness.FreshnessTier;
import com.pricefresh.freshness.RequestCoalescer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class PrefetchSchedulerTest {

    @Mock
    TaskScheduler taskScheduler;

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private FreshnessStore store;
    private List<String> fetched;
    private Set<String> failing;
    private PrefetchScheduler<String> scheduler;

    @BeforeEach
    void setUp() {
        store = new FreshnessStore(Clock.systemUTC());
        fetched = new CopyOnWriteArrayList<>();
        failing = Set.of(CacheKeys.tokenList("56"));
        PrefetchPlan plan = new PrefetchPlan(
                List.of(CacheKeys.tokenList("1"), CacheKeys.tokenList("196"), CacheKeys.tokenList("56")),
                List.of(CacheKeys.tokenList("10")),
                Duration.ofMillis(500),
                Duration.ofSeconds(3),
                FreshnessTier.TOKEN_LIST.options());
        scheduler = new PrefetchScheduler<>(store, new RequestCoalescer(store), taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), plan, this::fetcherFor);
    }

    private Fetcher<String> fetcherFor(String key) {
        return () -> {
            fetched.add(key);
            if (failing.contains(key)) {
                return CompletableFuture.failedFuture(new FetchException("proxy down"));
            }
            return CompletableFuture.completedFuture("tokens of " + key);
        };
    }

    private Runnable nextScheduledTask(int expectedCalls) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler, times(expectedCalls)).schedule(task.capture(), any(Instant.class));
        List<Runnable> all = new ArrayList<>(task.getAllValues());
        return all.get(all.size() - 1);
    }

    @Test
    @DisplayName("start schedules the priority pass after its delay, once")
    void startSchedulesOnce() {
        scheduler.start();
        scheduler.start();

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(any(Runnable.class), at.capture());
        verifyNoMoreInteractions(taskScheduler);
        assertThat(at.getValue()).isEqualTo(NOW.plusMillis(500));
        assertThat(scheduler.isStarted()).isTrue();
        assertThat(scheduler.isComplete()).isFalse();
        assertThat(fetched).isEmpty();
    }

    @Test
    @DisplayName("priority keys are warmed first, then secondary keys, then prefetch is complete")
    void tiersInOrder() {
        scheduler.start();

        nextScheduledTask(1).run();
        assertThat(fetched).containsExactly("token-list:1", "token-list:196", "token-list:56");
        assertThat(scheduler.isComplete()).isFalse();

        nextScheduledTask(2).run();
        assertThat(fetched).endsWith("token-list:10");
        assertThat(scheduler.isComplete()).isTrue();
        assertThat(store.<String>get("token-list:10").data()).contains("tokens of token-list:10");
    }

    @Test
    @DisplayName("secondary pass is scheduled relative to the injected clock")
    void secondaryDelayFromClock() {
        scheduler.start();
        nextScheduledTask(1).run();

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), at.capture());
        assertThat(at.getAllValues()).containsExactly(NOW.plusMillis(500), NOW.plusSeconds(3));
    }

    @Test
    @DisplayName("rejected secondary pass is contained and leaves prefetch incomplete")
    void rejectedSecondaryPass() {
        doReturn(null)
                .doThrow(new TaskRejectedException("scheduler shut down"))
                .when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        scheduler.start();

        nextScheduledTask(1).run();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(fetched).containsExactly("token-list:1", "token-list:196", "token-list:56");
        assertThat(scheduler.isComplete()).isFalse();
    }

    @Test
    @DisplayName("a failing key does not stop the other keys or the next tier")
    void failureIsContained() {
        scheduler.start();

        nextScheduledTask(1).run();
        nextScheduledTask(2).run();

        assertThat(store.get("token-list:56").isPresent()).isFalse();
        assertThat(store.get("token-list:1").isPresent()).isTrue();
        assertThat(scheduler.isComplete()).isTrue();
    }

    @Test
    @DisplayName("keys already cached are skipped")
    void cachedKeysSkipped() {
        store.set(CacheKeys.tokenList("1"), "cached", FreshnessTier.TOKEN_LIST.options());
        scheduler.start();

        nextScheduledTask(1).run();

        assertThat(fetched).containsExactly("token-list:196", "token-list:56");
        assertThat(store.<String>get("token-list:1").data()).contains("cached");
    }

    @Test
    @DisplayName("prefetch warms a single key on demand")
    void prefetchSingleKey() {
        scheduler.prefetch(CacheKeys.tokenList("43114"));
        scheduler.prefetch(CacheKeys.tokenList("43114"));

        assertThat(fetched).containsExactly("token-list:43114");
        assertThat(store.get("token-list:43114").isPresent()).isTrue();
    }
}
