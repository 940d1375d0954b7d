package com.barcache.core.exception;

/**
 * All attempts of a remote call failed. The last underlying error is the cause.
 */
public class FetchExhaustedException extends MarketDataException {

    private final int attempts;

    public FetchExhaustedException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
