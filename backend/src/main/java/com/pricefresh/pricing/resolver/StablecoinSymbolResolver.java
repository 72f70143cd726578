package com.pricefresh.pricing.resolver;

import com.pricefresh.common.StablecoinRegistry;
import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.SyncTokenPriceResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Last resort: a stablecoin ticker is assumed to trade at $1.00. Runs only after real price
 * discovery has come back empty.
 */
@Component
@RequiredArgsConstructor
public class StablecoinSymbolResolver implements SyncTokenPriceResolver {

    private final StablecoinRegistry stablecoinRegistry;

    @Override
    public PriceSource source() {
        return PriceSource.STABLECOIN_SYMBOL;
    }

    @Override
    public PriceResolutionResult resolveNow(PriceRequest request) {
        if (stablecoinRegistry.isStablecoinSymbol(request.getSymbol())) {
            return PriceResolutionResult.known(StablecoinRegistryResolver.ONE_USD, PriceSource.STABLECOIN_SYMBOL);
        }
        return PriceResolutionResult.unknown();
    }
}
