package com.pricefresh.pricing.resolver;

import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.SyncTokenPriceResolver;
import org.springframework.stereotype.Component;

/**
 * Unit price implied by a swap quote the caller already holds. Often more current than a price
 * index for newly listed tokens.
 */
@Component
public class RouterQuotePriceResolver implements SyncTokenPriceResolver {

    @Override
    public PriceSource source() {
        return PriceSource.ROUTER_QUOTE;
    }

    @Override
    public PriceResolutionResult resolveNow(PriceRequest request) {
        return request.getKnownRouterPrice()
                .map(p -> PriceResolutionResult.known(p, PriceSource.ROUTER_QUOTE))
                .orElse(PriceResolutionResult.unknown());
    }
}
