package com.pricefresh.common;

/**
 * Chain index strings as used by the DEX aggregator (EVM chain ids, plus 501 for Solana).
 */
public final class ChainIds {

    public static final String ETHEREUM = "1";
    public static final String OPTIMISM = "10";
    public static final String BSC = "56";
    public static final String POLYGON = "137";
    public static final String X_LAYER = "196";
    public static final String SOLANA = "501";
    public static final String BASE = "8453";
    public static final String ARBITRUM = "42161";
    public static final String AVALANCHE = "43114";

    private ChainIds() {}
}
