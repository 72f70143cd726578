package com.pricefresh.freshness.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Freshness engine configuration. Documented in application.yml under pricefresh.freshness.
 */
@ConfigurationProperties(prefix = "pricefresh.freshness")
@Getter
@Setter
public class FreshnessProperties {

    /**
     * Resident entries before LRU eviction kicks in.
     */
    private int capacity = 500;
}
