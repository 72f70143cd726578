package com.pricefresh.prefetch;

import com.pricefresh.domain.TokenListEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts token list prefetching once the application is ready.
 */
@Component
@ConditionalOnProperty(prefix = "pricefresh.prefetch", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class PrefetchStartupListener {

    private final PrefetchScheduler<List<TokenListEntry>> tokenListPrefetchScheduler;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        tokenListPrefetchScheduler.start();
    }
}
