package com.nosota.traitmarket.api.request;

/**
 * Shared validation patterns for ledger identifiers.
 */
public final class Addresses {

    /** Base58 public key, 32 to 44 characters. */
    public static final String BASE58_ADDRESS = "^[1-9A-HJ-NP-Za-km-z]{32,44}$";

    /** Base58 transaction signature, 64 to 88 characters. */
    public static final String BASE58_SIGNATURE = "^[1-9A-HJ-NP-Za-km-z]{64,88}$";

    private Addresses() {
    }
}
