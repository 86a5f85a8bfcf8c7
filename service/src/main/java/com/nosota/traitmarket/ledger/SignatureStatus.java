package com.nosota.traitmarket.ledger;

/**
 * Confirmation depth of a transaction signature.
 *
 * @param signature  Transaction signature
 * @param observed   Ledger has seen the signature
 * @param confirmed  Reached confirmed (or finalized) commitment
 * @param finalized  Reached finalized commitment
 * @param error      Ledger error when the transaction was observed but failed
 */
public record SignatureStatus(
        String signature,
        boolean observed,
        boolean confirmed,
        boolean finalized,
        String error
) {

    public static SignatureStatus notFound(String signature) {
        return new SignatureStatus(signature, false, false, false, null);
    }

    public boolean failed() {
        return error != null;
    }
}
