package com.nosota.traitmarket.api.response;

import java.util.UUID;

/**
 * @param walletAddress  Wallet holding the allowance
 * @param traitId        Trait that can be redeemed
 * @param qtyAvailable   Remaining free redemptions
 */
public record GiftBalanceResponse(
        String walletAddress,
        UUID traitId,
        int qtyAvailable
) {
}
