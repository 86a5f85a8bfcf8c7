package com.nosota.traitmarket.api.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.nosota.traitmarket.api.model.PaymentMethod;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Unsigned transaction bundle returned to the buyer for signing.
 *
 * @param bundleId               Bundle UUID to pass back on submit
 * @param purchaseId             Purchase created for this checkout
 * @param serializedTransaction  Base64 encoded bundle message the wallet signs
 * @param requiredSignatures     Addresses that still have to sign (the buyer)
 * @param delegateSignatures     Addresses whose signatures are already applied by the server
 * @param priceAmount            Amount charged in the token's smallest unit (0 for gift redemptions)
 * @param paymentMethod          NATIVE, TOKEN or GIFT
 * @param hasPaymentInstruction  Whether the bundle carries a payment leg
 * @param hasUpdateInstruction   Whether the bundle carries the metadata-update leg
 * @param reservationExpiresAt   Deadline for submitting the signed bundle
 */
public record BuildTransactionResponse(
        UUID bundleId,
        UUID purchaseId,
        String serializedTransaction,
        List<String> requiredSignatures,
        List<String> delegateSignatures,
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        BigInteger priceAmount,
        PaymentMethod paymentMethod,
        boolean hasPaymentInstruction,
        boolean hasUpdateInstruction,
        LocalDateTime reservationExpiresAt
) {
}
