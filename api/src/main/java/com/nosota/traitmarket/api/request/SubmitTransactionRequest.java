package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.UUID;

/**
 * Request DTO for submitting a user-signed transaction bundle.
 *
 * @param bundleId       ID of the unsigned bundle returned by the build step
 * @param userSignature  Buyer's base58 signature over the bundle message
 */
public record SubmitTransactionRequest(
        @NotNull(message = "Bundle ID is required")
        UUID bundleId,

        @NotBlank(message = "User signature is required")
        @Pattern(regexp = Addresses.BASE58_SIGNATURE, message = "User signature must be a base58 signature")
        String userSignature
) {
}
