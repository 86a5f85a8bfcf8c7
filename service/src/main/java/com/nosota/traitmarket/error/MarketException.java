package com.nosota.traitmarket.error;

/**
 * Base type of all checkout errors. Each subclass maps to one actionable message
 * in {@code GlobalExceptionHandler}.
 */
public abstract class MarketException extends RuntimeException {

    protected MarketException(String message) {
        super(message);
    }

    protected MarketException(String message, Throwable cause) {
        super(message, cause);
    }
}
