package com.pricefresh.pricing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * USD value of a token amount for display, using only prices available without I/O.
 */
@Component
@RequiredArgsConstructor
public class UsdValueCalculator {

    private final TokenPriceResolverChain tokenPriceResolverChain;

    /**
     * @return amount × best synchronous price, or empty when the amount is not positive or the
     *         price is unknown
     */
    public Optional<Double> calculate(double amount, PriceRequest request) {
        if (Double.isNaN(amount) || Double.isInfinite(amount) || amount <= 0) {
            return Optional.empty();
        }
        return tokenPriceResolverChain.resolveSync(request)
                .getPriceUsd()
                .map(price -> amount * price);
    }
}
