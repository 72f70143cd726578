package com.pricefresh.pricing.provider;

import java.util.Map;
import java.util.Optional;

/**
 * Maps aggregator chain index to DexScreener chain slug. X Layer (196) is not indexed.
 */
public final class DexScreenerChainMapper {

    private DexScreenerChainMapper() {}

    private static final Map<String, String> CHAIN_SLUGS = Map.ofEntries(
            Map.entry("1", "ethereum"),
            Map.entry("56", "bsc"),
            Map.entry("137", "polygon"),
            Map.entry("42161", "arbitrum"),
            Map.entry("10", "optimism"),
            Map.entry("8453", "base"),
            Map.entry("43114", "avalanche"),
            Map.entry("250", "fantom"),
            Map.entry("324", "zksync"),
            Map.entry("59144", "linea"),
            Map.entry("534352", "scroll"),
            Map.entry("1101", "polygon-zkevm"),
            Map.entry("5000", "mantle"),
            Map.entry("81457", "blast"),
            Map.entry("7777777", "zora"),
            Map.entry("501", "solana")
    );

    /**
     * @param chainId aggregator chain index (e.g. "1", "42161")
     * @return DexScreener slug (e.g. "ethereum", "arbitrum") or empty if unsupported
     */
    public static Optional<String> toChainSlug(String chainId) {
        if (chainId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CHAIN_SLUGS.get(chainId.strip()));
    }
}
