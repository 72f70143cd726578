package com.pricefresh.freshness;

import java.util.Locale;

/**
 * Key builders for the cache namespaces. The store treats keys as opaque; these only keep call
 * sites consistent (addresses are lowercased so checksummed and plain forms share an entry).
 */
public final class CacheKeys {

    public static final String TOKEN_LIST_PREFIX = "token-list:";
    public static final String PRICE_PREFIX = "price:";
    public static final String QUOTE_PREFIX = "quote:";
    public static final String TOKEN_INFO_PREFIX = "token-info:";
    public static final String BALANCE_PREFIX = "balance:";
    public static final String GAS_PRICE_PREFIX = "gas-price:";

    private CacheKeys() {}

    public static String tokenList(String chainId) {
        return TOKEN_LIST_PREFIX + chainId;
    }

    public static String price(String chainId, String address) {
        return PRICE_PREFIX + chainId + ":" + normalize(address);
    }

    public static String quote(String chainId, String fromAddress, String toAddress, String amount) {
        return QUOTE_PREFIX + chainId + ":" + normalize(fromAddress) + ":" + normalize(toAddress) + ":" + amount;
    }

    public static String tokenInfo(String chainId, String address) {
        return TOKEN_INFO_PREFIX + chainId + ":" + normalize(address);
    }

    public static String balance(String chainId, String address, String wallet) {
        return BALANCE_PREFIX + chainId + ":" + normalize(address) + ":" + normalize(wallet);
    }

    public static String gasPrice(String chainId) {
        return GAS_PRICE_PREFIX + chainId;
    }

    /** Prefix matching every price key of one chain, for {@link FreshnessStore#invalidatePrefix}. */
    public static String pricesOfChain(String chainId) {
        return PRICE_PREFIX + chainId + ":";
    }

    /**
     * @return the chain id of a {@code token-list:} key, or null when the key is not one
     */
    public static String chainOfTokenList(String key) {
        if (key == null || !key.startsWith(TOKEN_LIST_PREFIX) || key.length() == TOKEN_LIST_PREFIX.length()) {
            return null;
        }
        return key.substring(TOKEN_LIST_PREFIX.length());
    }

    private static String normalize(String address) {
        return address == null ? "" : address.strip().toLowerCase(Locale.ROOT);
    }
}
