package com.nosota.traitmarket.api.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.nosota.traitmarket.api.model.PurchaseStatus;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a purchase.
 *
 * @param purchaseId      Purchase UUID
 * @param walletAddress   Buyer wallet
 * @param assetId         Target asset
 * @param traitId         Purchased trait
 * @param reservationId   Reservation backing the purchase
 * @param priceAmount     Amount charged (0 for gift redemptions)
 * @param tokenId         Payment token
 * @param treasuryWallet  Receiving treasury
 * @param giftRedemption  True when settled from a gift balance
 * @param status          Current status
 * @param txSignature     Ledger signature, null until broadcast
 * @param createdAt       Creation timestamp
 * @param updatedAt       Last status change
 */
public record PurchaseResponse(
        UUID purchaseId,
        String walletAddress,
        String assetId,
        UUID traitId,
        UUID reservationId,
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        BigInteger priceAmount,
        UUID tokenId,
        String treasuryWallet,
        boolean giftRedemption,
        PurchaseStatus status,
        String txSignature,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
