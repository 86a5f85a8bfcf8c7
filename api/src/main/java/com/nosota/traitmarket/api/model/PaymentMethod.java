package com.nosota.traitmarket.api.model;

/**
 * How a purchase is settled on the ledger.
 */
public enum PaymentMethod {
    /** Transfer of the ledger's native currency. */
    NATIVE,
    /** Transfer of a fungible token identified by its mint address. */
    TOKEN,
    /** Gift balance redemption; no payment instruction is included. */
    GIFT
}
