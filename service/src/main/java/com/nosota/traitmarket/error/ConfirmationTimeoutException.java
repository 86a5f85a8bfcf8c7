package com.nosota.traitmarket.error;

import lombok.Getter;

/**
 * Confirmation of a broadcast transaction was not observed in time. The final state is unknown;
 * the purchase stays pending for reconciliation.
 */
@Getter
public class ConfirmationTimeoutException extends MarketException {

    private final String signature;

    public ConfirmationTimeoutException(String signature) {
        super("Confirmation of transaction " + signature + " was not observed in time");
        this.signature = signature;
    }
}
