package com.barcache.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * What the cache holds for one series. Derived on demand, never stored.
 *
 * @param minDate        earliest cached trade date, null when empty
 * @param maxDate        latest cached trade date, null when empty
 * @param rowCount       number of cached bars
 * @param lastCachedAt   cached_at of the newest (max-date) bar
 * @param coveredThrough end of the latest recorded fetch range (at least maxDate)
 * @param coveredAt      when the latest fetch range was recorded, informational only
 */
public record CoverageSummary(
    SeriesKey key,
    LocalDate minDate,
    LocalDate maxDate,
    long rowCount,
    Instant lastCachedAt,
    LocalDate coveredThrough,
    Instant coveredAt
) {

    public static CoverageSummary empty(SeriesKey key) {
        return new CoverageSummary(key, null, null, 0, null, null, null);
    }

    public boolean isEmpty() {
        return rowCount == 0 && coveredThrough == null;
    }

    public boolean hasRows() {
        return rowCount > 0;
    }

    /**
     * Age of the newest cached bar at {@code now}, or null when no bars are cached.
     */
    public Duration age(Instant now) {
        return lastCachedAt == null ? null : Duration.between(lastCachedAt, now);
    }

    public boolean isWithinTtl(Instant now, Duration ttl) {
        Duration age = age(now);
        return age != null && age.compareTo(ttl) < 0;
    }

    /**
     * Fresh for a request ending at {@code requestedEnd}: the newest bar was written within the TTL
     * and the request does not reach past it. Fetched ranges with no bars after {@code maxDate}
     * do not count.
     */
    public boolean isFresh(LocalDate requestedEnd, Instant now, Duration ttl) {
        return maxDate != null
            && !requestedEnd.isAfter(maxDate)
            && isWithinTtl(now, ttl);
    }
}
