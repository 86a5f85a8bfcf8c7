package com.nosota.traitmarket.error;

import lombok.Getter;

/**
 * Ledger dry run rejected the bundle. Retrying only helps after the cause is fixed
 * (for example after topping up the buyer's balance).
 */
@Getter
public class SimulationException extends MarketException {

    private final boolean paymentExecuted;
    private final boolean updateExecuted;

    public SimulationException(String message, boolean paymentExecuted, boolean updateExecuted) {
        super(message);
        this.paymentExecuted = paymentExecuted;
        this.updateExecuted = updateExecuted;
    }
}
