package com.barcache.core.exception;

import java.time.Instant;

/**
 * Raised without contacting the provider while the circuit breaker is open.
 */
public class CircuitOpenException extends MarketDataException {

    private final Instant retryAt;

    public CircuitOpenException(String message, Instant retryAt) {
        super(message);
        this.retryAt = retryAt;
    }

    /**
     * Earliest moment a trial call will be admitted.
     */
    public Instant getRetryAt() {
        return retryAt;
    }
}
