package com.pricefresh.domain;

/**
 * Where a resolved USD price came from, in resolution order.
 */
public enum PriceSource {
    EXPLICIT_API,
    ROUTER_QUOTE,
    STABLECOIN_REGISTRY,
    DEX_PAIR,
    SYMBOL_AGGREGATOR,
    WRAPPED_UNDERLYING,
    STABLECOIN_SYMBOL,
    UNKNOWN
}
