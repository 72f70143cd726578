package com.pricefresh.pricing.resolver;

import com.pricefresh.common.StablecoinRegistry;
import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.SyncTokenPriceResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves stablecoins recognised by (chain, contract address) to exactly $1.00.
 */
@Component
@RequiredArgsConstructor
public class StablecoinRegistryResolver implements SyncTokenPriceResolver {

    static final double ONE_USD = 1.0;

    private final StablecoinRegistry stablecoinRegistry;

    @Override
    public PriceSource source() {
        return PriceSource.STABLECOIN_REGISTRY;
    }

    @Override
    public PriceResolutionResult resolveNow(PriceRequest request) {
        if (stablecoinRegistry.isStablecoin(request.getChainId(), request.getTokenAddress())) {
            return PriceResolutionResult.known(ONE_USD, PriceSource.STABLECOIN_REGISTRY);
        }
        return PriceResolutionResult.unknown();
    }
}
