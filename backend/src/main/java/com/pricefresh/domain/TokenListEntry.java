package com.pricefresh.domain;

/**
 * One token of a chain's token list, as returned by the DEX aggregator.
 */
public record TokenListEntry(String address, String symbol, String name, int decimals, String logoUrl) {
}
