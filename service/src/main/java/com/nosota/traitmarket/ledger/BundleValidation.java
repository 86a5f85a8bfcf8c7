package com.nosota.traitmarket.ledger;

/**
 * Outcome of checking a bundle for the instructions an atomic purchase needs.
 *
 * @param valid                  True when every required leg is present
 * @param hasPaymentInstruction  Bundle carries a native or token transfer
 * @param hasUpdateInstruction   Bundle carries the metadata update
 * @param error                  Specific reason when invalid
 */
public record BundleValidation(
        boolean valid,
        boolean hasPaymentInstruction,
        boolean hasUpdateInstruction,
        String error
) {

    public static BundleValidation ok(boolean hasPaymentInstruction, boolean hasUpdateInstruction) {
        return new BundleValidation(true, hasPaymentInstruction, hasUpdateInstruction, null);
    }

    public static BundleValidation invalid(String error, boolean hasPaymentInstruction, boolean hasUpdateInstruction) {
        return new BundleValidation(false, hasPaymentInstruction, hasUpdateInstruction, error);
    }
}
