package com.nosota.traitmarket.api.model;

/**
 * Purchase status in the settlement flow.
 *
 * <p>Status only advances forward:
 * <pre>
 * CREATED → TX_BUILT → CONFIRMED → FULFILLED
 * </pre>
 * FAILED is reachable from any non-terminal status.
 */
public enum PurchaseStatus {
    /**
     * CREATED: Purchase recorded against a held reservation or granted gift balance.
     * No ledger transaction exists yet.
     */
    CREATED,

    /**
     * TX_BUILT: Transaction bundle assembled and validated, waiting for the user's signature
     * or for ledger confirmation once submitted.
     */
    TX_BUILT,

    /**
     * CONFIRMED: Ledger reported the submitted signature as confirmed.
     * Fulfillment bookkeeping follows.
     */
    CONFIRMED,

    /**
     * FULFILLED: Trait applied; supply decremented (paid path) and reservation consumed.
     * This is a final state.
     */
    FULFILLED,

    /**
     * FAILED: Validation, simulation, broadcast or ownership check failed.
     * Reservation has been released.
     * This is a final state.
     */
    FAILED
}
