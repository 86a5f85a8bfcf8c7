package com.nosota.traitmarket.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Reservation is no longer held (expired, cancelled or already consumed).
 * The buyer has to reserve again.
 */
@Getter
public class ReservationExpiredException extends MarketException {

    private final UUID reservationId;

    public ReservationExpiredException(UUID reservationId) {
        super("Reservation " + reservationId + " has expired or is no longer held");
        this.reservationId = reservationId;
    }
}
