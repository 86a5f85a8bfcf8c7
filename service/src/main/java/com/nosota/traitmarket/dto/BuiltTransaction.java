package com.nosota.traitmarket.dto;

import com.nosota.traitmarket.api.model.PaymentMethod;
import com.nosota.traitmarket.ledger.BundleValidation;
import com.nosota.traitmarket.ledger.TransactionBundle;
import com.nosota.traitmarket.model.Purchase;

import java.time.LocalDateTime;

/**
 * Result of building the bundle for a held reservation.
 *
 * @param purchase              Purchase in TX_BUILT
 * @param bundle                Delegate-signed bundle awaiting the buyer's signature
 * @param serializedMessage     Base64 message the buyer's wallet signs
 * @param validation            Leg check of the bundle
 * @param paymentMethod         Settlement route
 * @param reservationExpiresAt  Deadline for submitting the signature
 */
public record BuiltTransaction(
        Purchase purchase,
        TransactionBundle bundle,
        String serializedMessage,
        BundleValidation validation,
        PaymentMethod paymentMethod,
        LocalDateTime reservationExpiresAt
) {
}
