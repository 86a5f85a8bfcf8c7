package com.nosota.traitmarket.error;

/**
 * Bundle could not be composed or is missing a required instruction.
 * Always fatal to the current attempt.
 */
public class TransactionBuildException extends MarketException {

    public TransactionBuildException(String message) {
        super(message);
    }

    public TransactionBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
