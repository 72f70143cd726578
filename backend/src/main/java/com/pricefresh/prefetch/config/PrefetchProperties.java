package com.pricefresh.prefetch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Token list prefetch configuration. Documented in application.yml under pricefresh.prefetch.
 */
@ConfigurationProperties(prefix = "pricefresh.prefetch")
@Getter
@Setter
public class PrefetchProperties {

    /** Start prefetching once the application is ready. */
    private boolean enabled = true;

    /** Most used chains: Ethereum, X Layer, BSC, Base, Arbitrum, Polygon. */
    private List<String> priorityChains = new ArrayList<>(List.of("1", "196", "56", "8453", "42161", "137"));

    /** Optimism, Avalanche, Solana. */
    private List<String> secondaryChains = new ArrayList<>(List.of("10", "43114", "501"));

    private long priorityDelayMs = 500;

    /** Delay after the priority pass settles. */
    private long secondaryDelayMs = 3000;
}
