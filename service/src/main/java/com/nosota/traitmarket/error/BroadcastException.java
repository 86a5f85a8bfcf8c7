package com.nosota.traitmarket.error;

/**
 * Network or RPC failure while sending a transaction. Retryable with backoff.
 */
public class BroadcastException extends MarketException {

    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
