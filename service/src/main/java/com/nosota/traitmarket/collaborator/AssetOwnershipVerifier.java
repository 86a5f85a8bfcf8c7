package com.nosota.traitmarket.collaborator;

import reactor.core.publisher.Mono;

/**
 * Confirms that a wallet still holds the asset a trait is about to be applied to.
 */
public interface AssetOwnershipVerifier {

    Mono<Boolean> isOwner(String walletAddress, String assetId);
}
