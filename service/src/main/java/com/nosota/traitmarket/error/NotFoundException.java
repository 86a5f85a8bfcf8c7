package com.nosota.traitmarket.error;

/**
 * Requested catalog, reservation, purchase or bundle record does not exist.
 */
public class NotFoundException extends MarketException {

    public NotFoundException(String entity, Object id) {
        super(entity + " not found: " + id);
    }
}
