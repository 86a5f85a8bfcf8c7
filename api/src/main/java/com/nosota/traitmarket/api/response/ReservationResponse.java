package com.nosota.traitmarket.api.response;

import com.nosota.traitmarket.api.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a reservation.
 *
 * @param reservationId  Reservation UUID
 * @param traitId        Reserved trait
 * @param walletAddress  Buyer wallet
 * @param assetId        Target asset
 * @param status         Current status
 * @param createdAt      Timestamp when the hold was taken
 * @param expiresAt      Timestamp after which the hold no longer counts against supply
 */
public record ReservationResponse(
        UUID reservationId,
        UUID traitId,
        String walletAddress,
        String assetId,
        ReservationStatus status,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
}
