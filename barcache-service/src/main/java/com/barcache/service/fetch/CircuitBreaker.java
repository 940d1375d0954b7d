package com.barcache.service.fetch;

import com.barcache.service.fetch.CircuitBreakerState.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker.
 * <p>
 * CLOSED admits every call. After {@code threshold} consecutive failures it turns OPEN
 * and rejects calls until the cooldown has elapsed; it then admits exactly one trial call
 * (HALF_OPEN). A successful trial closes it and clears the counter; a failed trial re-opens
 * it and restarts the cooldown.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(int threshold, Duration cooldown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Ask permission for one attempt. Moves OPEN to HALF_OPEN once the cooldown elapsed.
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (!clock.instant().isBefore(openedAt.plus(cooldown))) {
                    state = State.HALF_OPEN;
                    trialInFlight = true;
                    log.info("Circuit breaker half-open, admitting one trial call");
                    return true;
                }
                return false;
            case HALF_OPEN:
            default:
                if (!trialInFlight) {
                    trialInFlight = true;
                    return true;
                }
                return false;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("Circuit breaker closed after successful trial call");
        }
        state = State.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN) {
            open();
            log.error("Circuit breaker trial call failed, re-opened for {}s", cooldown.toSeconds());
        } else if (state == State.CLOSED && consecutiveFailures >= threshold) {
            open();
            log.error("Circuit breaker opened after {} consecutive failures", consecutiveFailures);
        }
    }

    /**
     * Give back an admitted attempt whose outcome says nothing about provider health.
     */
    public synchronized void release() {
        if (state == State.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    private void open() {
        state = State.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
    }

    public synchronized Instant getRetryAt() {
        return openedAt == null ? null : openedAt.plus(cooldown);
    }

    public synchronized CircuitBreakerState getState() {
        return new CircuitBreakerState(state, consecutiveFailures, openedAt, getRetryAt());
    }

    public synchronized void reset() {
        state = State.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        log.info("Circuit breaker reset");
    }
}
