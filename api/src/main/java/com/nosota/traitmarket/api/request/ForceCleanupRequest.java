package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

/**
 * Admin request to expire specific reservations immediately.
 *
 * @param reservationIds  Reservations to expire (1..500); rows not in RESERVED are left untouched
 */
public record ForceCleanupRequest(
        @NotEmpty(message = "At least one reservation ID is required")
        @Size(max = 500, message = "At most 500 reservations per request")
        List<UUID> reservationIds
) {
}
