package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Request DTO for building the unsigned purchase transaction.
 *
 * @param reservationId  Held reservation to settle
 */
public record BuildTransactionRequest(
        @NotNull(message = "Reservation ID is required")
        UUID reservationId
) {
}
