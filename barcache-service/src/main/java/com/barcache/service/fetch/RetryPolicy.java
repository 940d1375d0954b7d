package com.barcache.service.fetch;

import java.time.Duration;

/**
 * Exponential backoff: the delay before retry {@code n} (0-based) is
 * {@code min(baseDelay * 2^n + jitter, maxDelay)}.
 *
 * @param maxRetries retries after the first attempt
 * @param maxJitter  upper bound of the random jitter added to each delay
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Duration maxJitter) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(32), Duration.ofMillis(250));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration delayFor(int retry, long jitterMs) {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        int shift = Math.min(retry, 30);
        long exponential = base > (max >> shift) ? max : base << shift;
        return Duration.ofMillis(Math.min(exponential + jitterMs, max));
    }

    /**
     * Delay after a rate-limit response: at least what the provider asked for, never above the cap.
     */
    public Duration delayForRateLimit(int retry, long jitterMs, long retryAfterMs) {
        long backoff = delayFor(retry, jitterMs).toMillis();
        long requested = Math.min(retryAfterMs, maxDelay.toMillis());
        return Duration.ofMillis(Math.max(backoff, requested));
    }
}
