package com.pricefresh.pricing.resolver;

import com.pricefresh.common.StablecoinRegistry;
import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextualPriceResolversTest {

    private final StablecoinRegistry registry = new StablecoinRegistry();

    @Test
    @DisplayName("explicit API price is used only when positive")
    void explicitApi() {
        ExplicitApiPriceResolver resolver = new ExplicitApiPriceResolver();

        assertThat(resolver.resolveNow(PriceRequest.builder().knownApiPrice(12.0).build()).getPriceSource())
                .isEqualTo(PriceSource.EXPLICIT_API);
        assertThat(resolver.resolveNow(PriceRequest.builder().knownApiPrice(-3.0).build()).isUnknown()).isTrue();
        assertThat(resolver.resolveNow(PriceRequest.of("1", "0xabc", "FOO")).isUnknown()).isTrue();
    }

    @Test
    @DisplayName("router quote price is used only when positive")
    void routerQuote() {
        RouterQuotePriceResolver resolver = new RouterQuotePriceResolver();

        assertThat(resolver.resolveNow(PriceRequest.builder().knownRouterPrice(0.5).build()).getPriceUsd()).contains(0.5);
        assertThat(resolver.resolveNow(PriceRequest.builder().knownRouterPrice(0.0).build()).isUnknown()).isTrue();
    }

    @Test
    @DisplayName("registry resolver needs the exact chain and address")
    void stablecoinRegistry() {
        StablecoinRegistryResolver resolver = new StablecoinRegistryResolver(registry);

        assertThat(resolver.resolveNow(PriceRequest.of("8453", "0x833589FCD6EDB6E08F4C7C32D4F71B54BDA02913", null))
                .getPriceUsd()).contains(1.0);
        assertThat(resolver.resolveNow(PriceRequest.of("8453", "0x0000000000000000000000000000000000000001", "USDC"))
                .isUnknown()).isTrue();
    }

    @Test
    @DisplayName("ticker resolver treats stablecoin symbols as $1")
    void stablecoinSymbol() {
        StablecoinSymbolResolver resolver = new StablecoinSymbolResolver(registry);

        assertThat(resolver.resolveNow(PriceRequest.of("501", "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB", "usdt"))
                .getPriceSource()).isEqualTo(PriceSource.STABLECOIN_SYMBOL);
        assertThat(resolver.resolveNow(PriceRequest.of("501", "So11111111111111111111111111111111111111112", "SOL"))
                .isUnknown()).isTrue();
    }
}
