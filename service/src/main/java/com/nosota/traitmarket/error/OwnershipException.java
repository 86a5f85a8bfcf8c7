package com.nosota.traitmarket.error;

/**
 * Wallet no longer holds the asset the trait would be applied to.
 */
public class OwnershipException extends MarketException {

    public OwnershipException(String walletAddress, String assetId) {
        super("Asset " + assetId + " is not owned by wallet " + walletAddress);
    }
}
