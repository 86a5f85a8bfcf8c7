package com.nosota.traitmarket.dto;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Price and supply of a trait as seen at checkout.
 *
 * @param traitId          Trait UUID
 * @param name             Display name
 * @param priceAmount      Price in the token's smallest unit
 * @param tokenId          Payment token UUID
 * @param tokenSymbol      Payment token ticker
 * @param tokenMint        Mint address, null for the native currency
 * @param totalSupply      Total units, null when unlimited
 * @param remainingSupply  Units not yet fulfilled, null when unlimited
 * @param active           Whether the trait can be sold
 */
public record TraitListing(
        UUID traitId,
        String name,
        BigInteger priceAmount,
        UUID tokenId,
        String tokenSymbol,
        String tokenMint,
        Integer totalSupply,
        Integer remainingSupply,
        boolean active
) {

    public boolean isUnlimited() {
        return totalSupply == null;
    }

    public boolean isNativePayment() {
        return tokenMint == null;
    }
}
