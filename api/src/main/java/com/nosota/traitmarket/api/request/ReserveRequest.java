package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.UUID;

/**
 * Request DTO for reserving one unit of a trait.
 *
 * @param traitId        Trait to reserve
 * @param walletAddress  Buyer wallet address (base58)
 * @param assetId        Asset the trait will be applied to (base58)
 */
public record ReserveRequest(
        @NotNull(message = "Trait ID is required")
        UUID traitId,

        @NotBlank(message = "Wallet address is required")
        @Pattern(regexp = Addresses.BASE58_ADDRESS, message = "Wallet address must be a base58 ledger address")
        String walletAddress,

        @NotBlank(message = "Asset ID is required")
        @Pattern(regexp = Addresses.BASE58_ADDRESS, message = "Asset ID must be a base58 ledger address")
        String assetId
) {
}
