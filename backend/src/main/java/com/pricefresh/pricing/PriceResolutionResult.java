package com.pricefresh.pricing;

import com.pricefresh.domain.PriceSource;
import lombok.Getter;

import java.util.Optional;

/**
 * Result of price resolution. Either a positive price with its source or UNKNOWN; never zero.
 */
@Getter
public class PriceResolutionResult {

    private static final PriceResolutionResult UNKNOWN = new PriceResolutionResult(null, PriceSource.UNKNOWN);

    private final Double priceUsd;
    private final PriceSource priceSource;

    private PriceResolutionResult(Double priceUsd, PriceSource priceSource) {
        this.priceUsd = priceUsd;
        this.priceSource = priceSource;
    }

    /**
     * Known result when {@code priceUsd} is a finite positive number, UNKNOWN otherwise.
     */
    public static PriceResolutionResult known(Double priceUsd, PriceSource source) {
        if (!isUsablePrice(priceUsd) || source == null || source == PriceSource.UNKNOWN) {
            return UNKNOWN;
        }
        return new PriceResolutionResult(priceUsd, source);
    }

    public static PriceResolutionResult unknown() {
        return UNKNOWN;
    }

    public static boolean isUsablePrice(Double price) {
        return price != null && !price.isNaN() && !price.isInfinite() && price > 0;
    }

    public boolean isUnknown() {
        return priceSource == PriceSource.UNKNOWN || priceUsd == null;
    }

    public Optional<Double> getPriceUsd() {
        return Optional.ofNullable(priceUsd);
    }

    @Override
    public String toString() {
        return isUnknown() ? "UNKNOWN" : priceUsd + " (" + priceSource + ")";
    }
}
