package com.nosota.traitmarket.collaborator;

import com.nosota.traitmarket.dto.AssetRecord;
import reactor.core.publisher.Mono;

/**
 * Read access to an index of ledger assets.
 */
public interface AssetIndex {

    /**
     * @return the asset, or empty when the index does not know it; a
     *         {@link com.nosota.traitmarket.error.BroadcastException} when the index cannot answer
     */
    Mono<AssetRecord> getAsset(String assetId);
}
