package com.nosota.traitmarket.api.response;

/**
 * Reservation together with its remaining hold time.
 *
 * @param reservation           Reservation details
 * @param expired               True when expiresAt has passed (even if the sweep has not run yet)
 * @param timeRemainingSeconds  Seconds until expiry, 0 when expired or no longer RESERVED
 */
public record ReservationStatusResponse(
        ReservationResponse reservation,
        boolean expired,
        long timeRemainingSeconds
) {
}
