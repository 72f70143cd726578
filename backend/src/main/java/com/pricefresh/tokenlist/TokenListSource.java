package com.pricefresh.tokenlist;

import com.pricefresh.domain.TokenListEntry;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies the tradable token list of one chain.
 */
public interface TokenListSource {

    CompletableFuture<List<TokenListEntry>> getTokens(String chainId);
}
