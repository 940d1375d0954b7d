package com.barcache.service.fetch;

import java.time.Instant;

/**
 * Snapshot of a circuit breaker.
 *
 * @param openedAt when the breaker last opened, null when closed
 * @param retryAt  earliest moment a trial call is admitted, null when closed
 */
public record CircuitBreakerState(
    State state,
    int consecutiveFailures,
    Instant openedAt,
    Instant retryAt
) {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public boolean isOpen() {
        return state != State.CLOSED;
    }
}
