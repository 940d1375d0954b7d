package com.barcache.core.exception;

/**
 * Failure reported by, or on the way to, the remote market-data provider.
 * Retryable unless a subclass says otherwise.
 */
public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
