package com.nosota.traitmarket.ledger;

/**
 * Per-leg outcome of a dry run.
 *
 * @param success          Whole bundle would commit
 * @param paymentExecuted  Payment leg ran without error
 * @param updateExecuted   Metadata-update leg ran without error
 * @param error            Ledger error text when the dry run failed
 */
public record SimulationResult(
        boolean success,
        boolean paymentExecuted,
        boolean updateExecuted,
        String error
) {
}
