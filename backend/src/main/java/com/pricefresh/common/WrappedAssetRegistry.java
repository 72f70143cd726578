package com.pricefresh.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Chain-specific wrapped representations of major assets, mapped to the ticker of the asset they
 * wrap. Mostly X Layer tokens, which the pair-price providers do not index.
 */
@Component
public class WrappedAssetRegistry {

    /**
     * @param underlyingTicker lowercase ticker of the wrapped asset (e.g. "btc")
     * @param symbol           ticker of the wrapper itself (e.g. "XBTC")
     */
    public record WrappedAsset(String underlyingTicker, String symbol) {}

    private static final Map<String, Map<String, WrappedAsset>> WRAPPED_BY_CHAIN = Map.of(
            ChainIds.X_LAYER, Map.of(
                    "0xb7c00000bcdeef966b20b3d884b98e64d2b06b4f", new WrappedAsset("btc", "XBTC"),
                    "0xe7b000003a45145decf8a28fc755ad5ec5ea025a", new WrappedAsset("eth", "XETH"),
                    "0x505000008de8748dbd4422ff4687a4fc9beba15b", new WrappedAsset("sol", "XSOL"),
                    "0x5a77f1443d16ee5761d310e38b62f77f726bc71c", new WrappedAsset("eth", "WETH"),
                    "0xe538905cf8410324e03a5a23c1c177a474d59b2b", new WrappedAsset("okb", "WOKB"))
    );

    public boolean isWrapped(String chainId, String contractAddress) {
        return find(chainId, contractAddress).isPresent();
    }

    /**
     * @return the wrapped asset entry, or empty when the token is not a known wrapper on that chain
     */
    public Optional<WrappedAsset> find(String chainId, String contractAddress) {
        if (chainId == null || contractAddress == null || contractAddress.isBlank()) {
            return Optional.empty();
        }
        Map<String, WrappedAsset> known = WRAPPED_BY_CHAIN.get(chainId.strip());
        if (known == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(known.get(contractAddress.toLowerCase(Locale.ROOT).strip()));
    }

    public Optional<String> underlyingTicker(String chainId, String contractAddress) {
        return find(chainId, contractAddress).map(WrappedAsset::underlyingTicker);
    }
}
