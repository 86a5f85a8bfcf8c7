package com.nosota.traitmarket.error;

/**
 * Malformed or inconsistent input (inactive trait, mismatched reservation, bad signature format).
 */
public class ValidationException extends MarketException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
