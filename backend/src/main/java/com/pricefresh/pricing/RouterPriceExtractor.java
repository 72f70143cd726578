package com.pricefresh.pricing;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Reads per-leg unit prices from a swap router quote. Routers disagree on field names, so
 * {@code *TokenUnitPrice} is tried first and {@code *TokenPrice} second.
 */
public final class RouterPriceExtractor {

    private RouterPriceExtractor() {}

    public static RouterPrices extract(JsonNode routerResult) {
        if (routerResult == null || routerResult.isNull() || routerResult.isMissingNode()) {
            return RouterPrices.none();
        }
        return new RouterPrices(
                firstUsable(routerResult, "fromTokenUnitPrice", "fromTokenPrice"),
                firstUsable(routerResult, "toTokenUnitPrice", "toTokenPrice"));
    }

    private static Optional<Double> firstUsable(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<Double> value = parse(node.path(field));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Numbers or numeric strings; zero, NaN and infinities count as absent.
     */
    static Optional<Double> parse(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        double d;
        if (value.isNumber()) {
            d = value.doubleValue();
        } else if (value.isTextual() && !value.asText().isBlank()) {
            try {
                d = Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        if (Double.isNaN(d) || Double.isInfinite(d) || d == 0) {
            return Optional.empty();
        }
        return Optional.of(d);
    }
}
