package com.nosota.traitmarket.dto;

import com.nosota.traitmarket.model.Purchase;

/**
 * Result of submitting a signed bundle.
 *
 * @param purchase         Purchase after the submit
 * @param paymentExecuted  Payment leg committed on the ledger
 * @param updateExecuted   Metadata-update leg committed on the ledger
 * @param pending          Broadcast succeeded but confirmation was not observed in time
 * @param message          Outcome shown to the buyer
 */
public record SubmissionOutcome(
        Purchase purchase,
        boolean paymentExecuted,
        boolean updateExecuted,
        boolean pending,
        String message
) {
}
