package com.nosota.traitmarket.collaborator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Ownership check against the asset index.
 *
 * <p>Only an asset the index does not know, or one held by another wallet, counts as not owned.
 * Index outages propagate as {@link com.nosota.traitmarket.error.BroadcastException}.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   ownership:
 *     enabled: true     # false skips the check (local runs only)
 * </pre>
 */
@Component
@Slf4j
public class DasAssetOwnershipVerifier implements AssetOwnershipVerifier {

    private final AssetIndex assetIndex;
    private final boolean enabled;

    public DasAssetOwnershipVerifier(AssetIndex assetIndex,
                                     @Value("${market.ownership.enabled:true}") boolean enabled) {
        this.assetIndex = assetIndex;
        this.enabled = enabled;
    }

    @Override
    public Mono<Boolean> isOwner(String walletAddress, String assetId) {
        if (!enabled) {
            log.warn("Ownership verification disabled, accepting wallet={} asset={}", walletAddress, assetId);
            return Mono.just(true);
        }

        log.debug("Verifying ownership: wallet={}, asset={}", walletAddress, assetId);
        return assetIndex.getAsset(assetId)
                .map(asset -> {
                    boolean owned = walletAddress.equals(asset.owner());
                    if (!owned) {
                        log.info("Ownership mismatch: asset={}, expected={}, actual={}",
                                assetId, walletAddress, asset.owner());
                    }
                    return owned;
                })
                .switchIfEmpty(Mono.fromCallable(() -> {
                    log.warn("Asset {} not found by index, wallet {} treated as non-owner", assetId, walletAddress);
                    return false;
                }));
    }
}
