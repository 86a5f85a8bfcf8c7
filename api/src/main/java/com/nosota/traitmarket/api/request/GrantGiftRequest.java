package com.nosota.traitmarket.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.util.UUID;

/**
 * Request DTO for granting free redemptions of a trait to a wallet.
 *
 * @param walletAddress  Receiving wallet
 * @param traitId        Trait that can be redeemed
 * @param quantity       Number of redemptions to add (1..1000)
 */
public record GrantGiftRequest(
        @NotBlank(message = "Wallet address is required")
        @Pattern(regexp = Addresses.BASE58_ADDRESS, message = "Wallet address must be a base58 ledger address")
        String walletAddress,

        @NotNull(message = "Trait ID is required")
        UUID traitId,

        @NotNull(message = "Quantity is required")
        @Positive(message = "Quantity must be positive")
        @Max(value = 1000, message = "Quantity must not exceed 1000")
        Integer quantity
) {
}
