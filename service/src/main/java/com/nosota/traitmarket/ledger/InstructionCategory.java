package com.nosota.traitmarket.ledger;

/**
 * The two legs an atomic purchase transaction is made of.
 */
public enum InstructionCategory {
    /** Moves the price from the buyer to the treasury. */
    PAYMENT,
    /** Rewrites the asset's metadata pointer; authorized by the delegate. */
    METADATA_UPDATE
}
