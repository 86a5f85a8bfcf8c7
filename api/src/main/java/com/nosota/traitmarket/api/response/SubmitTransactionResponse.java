package com.nosota.traitmarket.api.response;

import com.nosota.traitmarket.api.model.PurchaseStatus;

import java.util.UUID;

/**
 * Result of submitting a signed bundle.
 *
 * <p>A status of TX_BUILT with a signature means the transaction was broadcast but its
 * confirmation was not observed in time; the purchase is left for reconciliation.
 *
 * @param purchaseId       Purchase UUID
 * @param status           Purchase status after the submit
 * @param txSignature      Ledger signature, null if the broadcast never succeeded
 * @param paymentExecuted  Whether the payment leg was committed
 * @param updateExecuted   Whether the metadata-update leg was committed
 * @param message          Human-readable outcome
 */
public record SubmitTransactionResponse(
        UUID purchaseId,
        PurchaseStatus status,
        String txSignature,
        boolean paymentExecuted,
        boolean updateExecuted,
        String message
) {
}
