package com.barcache.service.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Enforces a minimum spacing between remote calls for every thread sharing the instance.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Duration minSpacing;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Object rateLimitLock = new Object();
    private long lastRequestTime = Long.MIN_VALUE;

    public RateLimiter(Duration minSpacing, Sleeper sleeper, Clock clock) {
        this.minSpacing = minSpacing;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Block until the next call may go out.
     */
    public void acquire() throws InterruptedException {
        if (minSpacing.isZero()) {
            return;
        }
        synchronized (rateLimitLock) {
            long now = clock.millis();
            if (lastRequestTime != Long.MIN_VALUE) {
                long elapsed = now - lastRequestTime;
                long waitTime = minSpacing.toMillis() - elapsed;
                if (waitTime > 0) {
                    log.debug("Rate limiting: waiting {}ms", waitTime);
                    sleeper.sleep(Duration.ofMillis(waitTime));
                }
            }
            lastRequestTime = clock.millis();
        }
    }

    public Duration getMinSpacing() {
        return minSpacing;
    }
}
