package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Confirmation callback for a broadcast transaction.
 *
 * @param txSignature  Ledger signature reported as confirmed
 */
public record ConfirmationRequest(
        @NotBlank(message = "Transaction signature is required")
        @Pattern(regexp = Addresses.BASE58_SIGNATURE, message = "Transaction signature must be a base58 signature")
        String txSignature
) {
}
