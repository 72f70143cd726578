package com.pricefresh.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of fiat-pegged stablecoins, by contract address per chain and by ticker.
 * The address table is authoritative; the ticker table is a heuristic for tokens with no price.
 */
@Component
public class StablecoinRegistry {

    private static final Map<String, Set<String>> STABLECOINS_BY_CHAIN = Map.of(
            ChainIds.ETHEREUM, addresses(
                    "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",  // USDC
                    "0xdac17f958d2ee523a2206206994597c13d831ec7",  // USDT
                    "0x6b175474e89094c44da98b954eedeac495271d0f",  // DAI
                    "0x40d16fc9686d086299136be70377984c4e2e770a",  // GHO
                    "0x4c9edd5852cd905f086c759e8383e09bff1e68b3",  // USDe
                    "0x853d955acef822db058eb8505911ed77f175b99e",  // FRAX
                    "0x6c3ea9036406852006290770bedfcaba0e23a0e8"), // PYUSD
            ChainIds.ARBITRUM, addresses(
                    "0xaf88d065e77c8cc2239327c5edb3a432268e5831",  // USDC
                    "0xfd086bc7cd5c481dcc9c85ebe478a1c0b69fcbb9",  // USDT
                    "0xda10009cbd5d07dd0cecc66161fc93d7c9000da1"), // DAI
            ChainIds.OPTIMISM, addresses(
                    "0x0b2c639c533813f4aa9d7837caf62653d097ff85",  // USDC
                    "0x94b008aa00579c1307b0ef2c499ad98a8ce58e58",  // USDT
                    "0xda10009cbd5d07dd0cecc66161fc93d7c9000da1"), // DAI
            ChainIds.POLYGON, addresses(
                    "0x3c499c542cef5e3811e1192ce70d8cc03d5c3359",  // USDC
                    "0xc2132d05d31c914a87c6611c10748aeb04b58e8f"), // USDT
            ChainIds.BASE, addresses(
                    "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913"), // USDC
            ChainIds.BSC, addresses(
                    "0x8ac76a51cc950d9822d68b83fe1ad97b32cd580d",  // USDC
                    "0x55d398326f99059ff775485246999027b3197955"), // USDT
            ChainIds.AVALANCHE, addresses(
                    "0xb97ef9ef8734c71904d8002f8b6bc66dd9c48a6e",  // USDC
                    "0x9702230a8ea53601f5cd2dc00fdbc13d4df4a8c7"), // USDT
            ChainIds.X_LAYER, addresses(
                    "0x4ae46a509f6b1d9056937ba4500cb143933d2dc8",  // USDG
                    "0x779ded0c9e1022225f8e0630b35a9b54be713736",  // USD₮0
                    "0x1e4a5963abfd975d8c9021ce480b42188849d41d",  // USDT
                    "0x74b7f16337b8972027f6196a17a631ac6de26d22")  // USDC
    );

    private static final Set<String> STABLECOIN_SYMBOLS = Stream.of(
            "USDT", "USDC", "USDG", "DAI", "BUSD", "TUSD", "FRAX", "LUSD",
            "USDD", "USDN", "MIM", "GUSD", "USDP", "SUSD", "CUSD", "EURS",
            "EUROC", "EURT", "PYUSD", "FDUSD"
    ).collect(Collectors.toUnmodifiableSet());

    /**
     * Returns true if the contract address (any case) is a known stablecoin on the given chain.
     */
    public boolean isStablecoin(String chainId, String contractAddress) {
        if (chainId == null || contractAddress == null || contractAddress.isBlank()) {
            return false;
        }
        Set<String> known = STABLECOINS_BY_CHAIN.get(chainId.strip());
        return known != null && known.contains(contractAddress.toLowerCase(Locale.ROOT).strip());
    }

    /**
     * Returns true if the ticker (any case) is a known stablecoin symbol.
     */
    public boolean isStablecoinSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return STABLECOIN_SYMBOLS.contains(symbol.toUpperCase(Locale.ROOT).strip());
    }

    private static Set<String> addresses(String... values) {
        return Stream.of(values).map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }
}
