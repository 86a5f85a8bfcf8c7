package com.nosota.traitmarket.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Every unit of a capped trait is either fulfilled or held by an active reservation.
 */
@Getter
public class OutOfStockException extends MarketException {

    private final UUID traitId;

    public OutOfStockException(UUID traitId) {
        super("Trait " + traitId + " is no longer available");
        this.traitId = traitId;
    }
}
