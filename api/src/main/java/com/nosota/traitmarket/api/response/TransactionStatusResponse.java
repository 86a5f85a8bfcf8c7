package com.nosota.traitmarket.api.response;

/**
 * Ledger confirmation depth of a signature.
 *
 * @param signature  Transaction signature
 * @param observed   False when the ledger has not seen the signature yet
 * @param confirmed  Reached confirmed commitment
 * @param finalized  Reached finalized commitment
 * @param error      Ledger error text when the transaction was observed but failed
 */
public record TransactionStatusResponse(
        String signature,
        boolean observed,
        boolean confirmed,
        boolean finalized,
        String error
) {
}
