package com.nosota.traitmarket.api.model;

/**
 * Lifecycle of a reservation (a time-bounded hold on one unit of trait supply).
 * RESERVED is the only non-terminal state. Rows in any other state are never changed again.
 */
public enum ReservationStatus {
    /**
     * RESERVED: Unit is held for a wallet/asset pair until expiresAt.
     * Counts against the trait's remaining supply while unexpired.
     */
    RESERVED,

    /**
     * CONSUMED: Hold was converted into a fulfilled purchase.
     * This is a final state.
     */
    CONSUMED,

    /**
     * EXPIRED: Hold outlived its TTL and was reclaimed by the cleanup sweep.
     * This is a final state.
     */
    EXPIRED,

    /**
     * CANCELLED: Hold was released explicitly or because the purchase failed.
     * This is a final state.
     */
    CANCELLED
}
