package com.pricefresh.tokenlist.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token list source configuration. Documented in application.yml under pricefresh.token-list.
 */
@ConfigurationProperties(prefix = "pricefresh.token-list")
@Getter
@Setter
public class TokenListProperties {

    /**
     * URL of the DEX aggregator proxy function accepting {"action": ..., "params": {...}}.
     */
    private String proxyUrl = "http://localhost:54321/functions/v1/okx-dex";

    /**
     * Read timeout in seconds; token lists can be large.
     */
    private int readTimeoutSeconds = 20;
}
