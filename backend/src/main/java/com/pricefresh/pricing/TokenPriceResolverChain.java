package com.pricefresh.pricing;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ordered price sources: explicit API price → router quote price → stablecoin registry →
 * DEX pair price → symbol aggregator → wrapped-asset underlying → stablecoin ticker → UNKNOWN.
 * The first source with a positive price wins. A failing source counts as "no price"; the chain
 * itself never throws.
 */
@Slf4j
public class TokenPriceResolverChain {

    private final List<TokenPriceResolver> resolvers;

    public TokenPriceResolverChain(List<TokenPriceResolver> resolvers) {
        this.resolvers = List.copyOf(resolvers);
    }

    public CompletableFuture<PriceResolutionResult> resolve(PriceRequest request) {
        if (request == null) {
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        return resolveFrom(0, request);
    }

    /**
     * Non-blocking variant: consults only sources that need no I/O.
     */
    public PriceResolutionResult resolveSync(PriceRequest request) {
        if (request == null) {
            return PriceResolutionResult.unknown();
        }
        for (TokenPriceResolver resolver : resolvers) {
            if (!(resolver instanceof SyncTokenPriceResolver sync)) {
                continue;
            }
            PriceResolutionResult r;
            try {
                r = sync.resolveNow(request);
            } catch (RuntimeException e) {
                log.debug("Price source {} failed for {}: {}", resolver.source(), request.getTokenAddress(), e.getMessage());
                continue;
            }
            if (isKnown(r)) {
                return r;
            }
        }
        return PriceResolutionResult.unknown();
    }

    public List<TokenPriceResolver> getResolvers() {
        return resolvers;
    }

    private CompletableFuture<PriceResolutionResult> resolveFrom(int index, PriceRequest request) {
        if (index >= resolvers.size()) {
            log.debug("No price for {} {} on chain {}", request.getSymbol(), request.getTokenAddress(), request.getChainId());
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        TokenPriceResolver resolver = resolvers.get(index);
        return attempt(resolver, request).thenCompose(r -> isKnown(r)
                ? CompletableFuture.completedFuture(r)
                : resolveFrom(index + 1, request));
    }

    private CompletableFuture<PriceResolutionResult> attempt(TokenPriceResolver resolver, PriceRequest request) {
        CompletableFuture<PriceResolutionResult> future;
        try {
            future = resolver.resolve(request);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(PriceResolutionResult.unknown());
        }
        return future.exceptionally(e -> {
            log.debug("Price source {} failed for {}: {}", resolver.source(), request.getTokenAddress(), e.getMessage());
            return PriceResolutionResult.unknown();
        });
    }

    private static boolean isKnown(PriceResolutionResult r) {
        return r != null && !r.isUnknown() && PriceResolutionResult.isUsablePrice(r.getPriceUsd().orElse(null));
    }
}
