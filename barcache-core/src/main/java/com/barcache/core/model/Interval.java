package com.barcache.core.model;

import java.time.Duration;

/**
 * Bar sizes supported by the remote provider.
 * Each interval carries the provider's limit on how many calendar days
 * a single historical request may span.
 */
public enum Interval {
    ONE_MINUTE(Duration.ofMinutes(1), 30),
    THREE_MINUTE(Duration.ofMinutes(3), 60),
    FIVE_MINUTE(Duration.ofMinutes(5), 100),
    TEN_MINUTE(Duration.ofMinutes(10), 100),
    FIFTEEN_MINUTE(Duration.ofMinutes(15), 200),
    THIRTY_MINUTE(Duration.ofMinutes(30), 200),
    ONE_HOUR(Duration.ofHours(1), 400),
    ONE_DAY(Duration.ofDays(1), 2000);

    private final Duration barDuration;
    private final int maxDaysPerRequest;

    Interval(Duration barDuration, int maxDaysPerRequest) {
        this.barDuration = barDuration;
        this.maxDaysPerRequest = maxDaysPerRequest;
    }

    public Duration getBarDuration() {
        return barDuration;
    }

    public int getMaxDaysPerRequest() {
        return maxDaysPerRequest;
    }

    public boolean isIntraday() {
        return this != ONE_DAY;
    }

    /**
     * Parse an interval name, case-insensitive.
     */
    public static Interval fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Interval must not be empty");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
