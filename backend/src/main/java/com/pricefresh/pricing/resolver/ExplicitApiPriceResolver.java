package com.pricefresh.pricing.resolver;

import com.pricefresh.domain.PriceSource;
import com.pricefresh.pricing.PriceRequest;
import com.pricefresh.pricing.PriceResolutionResult;
import com.pricefresh.pricing.SyncTokenPriceResolver;
import org.springframework.stereotype.Component;

/**
 * First-party price the caller already got from the price API.
 */
@Component
public class ExplicitApiPriceResolver implements SyncTokenPriceResolver {

    @Override
    public PriceSource source() {
        return PriceSource.EXPLICIT_API;
    }

    @Override
    public PriceResolutionResult resolveNow(PriceRequest request) {
        return request.getKnownApiPrice()
                .map(p -> PriceResolutionResult.known(p, PriceSource.EXPLICIT_API))
                .orElse(PriceResolutionResult.unknown());
    }
}
