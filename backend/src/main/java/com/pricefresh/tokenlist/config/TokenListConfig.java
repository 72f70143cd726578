package com.pricefresh.tokenlist.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TokenListProperties.class)
public class TokenListConfig {
}
