package com.pricefresh.pricing.provider;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ticker → CoinGecko coin id, the key DefiLlama uses for "coingecko:{id}" lookups.
 */
public final class TickerToCoinGeckoIdMapper {

    private TickerToCoinGeckoIdMapper() {}

    private static final Map<String, String> COIN_IDS = Map.ofEntries(
            // majors
            Map.entry("btc", "bitcoin"),
            Map.entry("eth", "ethereum"),
            Map.entry("sol", "solana"),
            Map.entry("xrp", "ripple"),
            Map.entry("ada", "cardano"),
            Map.entry("doge", "dogecoin"),
            Map.entry("dot", "polkadot"),
            Map.entry("matic", "polygon"),
            Map.entry("ltc", "litecoin"),
            Map.entry("link", "chainlink"),
            Map.entry("atom", "cosmos"),
            Map.entry("xlm", "stellar"),
            Map.entry("trx", "tron"),
            Map.entry("etc", "ethereum-classic"),
            Map.entry("bch", "bitcoin-cash"),
            Map.entry("near", "near"),
            Map.entry("ftm", "fantom"),
            Map.entry("fil", "filecoin"),
            Map.entry("hbar", "hedera-hashgraph"),
            Map.entry("icp", "internet-computer"),
            Map.entry("avax", "avalanche-2"),
            Map.entry("bnb", "binancecoin"),
            Map.entry("okb", "okb"),
            Map.entry("ton", "the-open-network"),
            Map.entry("sui", "sui"),
            Map.entry("apt", "aptos"),
            // wrapped majors
            Map.entry("wbtc", "wrapped-bitcoin"),
            Map.entry("weth", "weth"),
            // stablecoins
            Map.entry("usdt", "tether"),
            Map.entry("usdc", "usd-coin"),
            Map.entry("dai", "dai"),
            Map.entry("busd", "binance-usd"),
            Map.entry("tusd", "true-usd"),
            Map.entry("usdp", "paxos-standard"),
            Map.entry("frax", "frax"),
            // DeFi and L2
            Map.entry("uni", "uniswap"),
            Map.entry("aave", "aave"),
            Map.entry("mkr", "maker"),
            Map.entry("snx", "havven"),
            Map.entry("comp", "compound-governance-token"),
            Map.entry("crv", "curve-dao-token"),
            Map.entry("sushi", "sushi"),
            Map.entry("yfi", "yearn-finance"),
            Map.entry("ldo", "lido-dao"),
            Map.entry("arb", "arbitrum"),
            Map.entry("op", "optimism"),
            Map.entry("inj", "injective-protocol"),
            Map.entry("sei", "sei-network"),
            // meme
            Map.entry("shib", "shiba-inu"),
            Map.entry("pepe", "pepe"),
            Map.entry("floki", "floki"),
            Map.entry("bonk", "bonk"),
            Map.entry("wif", "dogwifcoin"),
            // gaming and data
            Map.entry("sand", "the-sandbox"),
            Map.entry("mana", "decentraland"),
            Map.entry("axs", "axie-infinity"),
            Map.entry("imx", "immutable-x"),
            Map.entry("ape", "apecoin"),
            Map.entry("rndr", "render-token"),
            Map.entry("grt", "the-graph"),
            Map.entry("fet", "fetch-ai"),
            Map.entry("rune", "thorchain"),
            Map.entry("kas", "kaspa")
    );

    /**
     * @param ticker any case (e.g. "BTC", "eth")
     * @return CoinGecko coin id or empty if the ticker is not mapped
     */
    public static Optional<String> toCoinGeckoId(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(COIN_IDS.get(ticker.strip().toLowerCase(Locale.ROOT)));
    }
}
