package com.pricefresh.freshness;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    @DisplayName("keys are namespaced and addresses lowercased")
    void namespacedKeys() {
        assertThat(CacheKeys.tokenList("196")).isEqualTo("token-list:196");
        assertThat(CacheKeys.price("1", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48"))
                .isEqualTo("price:1:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
        assertThat(CacheKeys.quote("1", "0xAA", "0xBB", "1000")).isEqualTo("quote:1:0xaa:0xbb:1000");
        assertThat(CacheKeys.tokenInfo("56", "0xCC")).isEqualTo("token-info:56:0xcc");
        assertThat(CacheKeys.balance("1", "0xCC", "0xWallet")).isEqualTo("balance:1:0xcc:0xwallet");
        assertThat(CacheKeys.gasPrice("8453")).isEqualTo("gas-price:8453");
    }

    @Test
    @DisplayName("chain prefix does not match chains sharing leading digits")
    void chainPrefix() {
        assertThat(CacheKeys.price("10", "0xaa")).doesNotStartWith(CacheKeys.pricesOfChain("1"));
        assertThat(CacheKeys.price("1", "0xaa")).startsWith(CacheKeys.pricesOfChain("1"));
    }

    @Test
    @DisplayName("chainOfTokenList extracts the chain or returns null")
    void chainOfTokenList() {
        assertThat(CacheKeys.chainOfTokenList("token-list:42161")).isEqualTo("42161");
        assertThat(CacheKeys.chainOfTokenList("token-list:")).isNull();
        assertThat(CacheKeys.chainOfTokenList("price:1:0xaa")).isNull();
        assertThat(CacheKeys.chainOfTokenList(null)).isNull();
    }
}
