package com.nosota.traitmarket.ledger;

/**
 * Outcome of broadcasting a signed bundle and waiting for confirmation.
 *
 * @param success          Transaction confirmed without error
 * @param signature        Transaction signature (present whenever the broadcast succeeded)
 * @param paymentExecuted  Payment leg committed
 * @param updateExecuted   Metadata-update leg committed
 * @param error            Ledger error text, verbatim
 */
public record SubmitResult(
        boolean success,
        String signature,
        boolean paymentExecuted,
        boolean updateExecuted,
        String error
) {
}
