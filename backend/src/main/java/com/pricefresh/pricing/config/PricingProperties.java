package com.pricefresh.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pricing module configuration. Documented in application.yml under pricefresh.pricing.
 */
@ConfigurationProperties(prefix = "pricefresh.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * DexScreener API base URL (free, no key).
     */
    private String dexscreenerBaseUrl = "https://api.dexscreener.com";

    /**
     * DefiLlama coins API base URL.
     */
    private String defillamaBaseUrl = "https://coins.llama.fi";

    /**
     * DexScreener token endpoints allow 300 requests per minute.
     */
    private int dexscreenerRequestsPerMinute = 300;

    private int defillamaRequestsPerMinute = 120;

    /**
     * Read timeout in seconds for provider calls; a timed-out call counts as "no price".
     */
    private int readTimeoutSeconds = 10;
}
