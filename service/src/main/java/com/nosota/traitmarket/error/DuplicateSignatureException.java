package com.nosota.traitmarket.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Signature is already attached to a purchase. Handled as a no-op by the orchestrator.
 */
@Getter
public class DuplicateSignatureException extends MarketException {

    private final String signature;
    private final UUID existingPurchaseId;

    public DuplicateSignatureException(String signature, UUID existingPurchaseId) {
        super("Signature " + signature + " already settles purchase " + existingPurchaseId);
        this.signature = signature;
        this.existingPurchaseId = existingPurchaseId;
    }
}
