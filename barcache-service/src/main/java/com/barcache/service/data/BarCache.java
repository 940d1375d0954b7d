package com.barcache.service.data;

import com.barcache.core.exception.CacheException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Persistent store of OHLCV bars with coverage and freshness bookkeeping.
 * Storage failures surface as {@link CacheException}; an absent series is an empty result.
 */
public interface BarCache extends AutoCloseable {

    /**
     * Cached bars of the series within [from, to] plus the sub-ranges that are
     * missing or stale and must be fetched again.
     */
    CacheLookup get(SeriesKey key, LocalDate from, LocalDate to) throws CacheException;

    /**
     * Upsert bars. Each series' row span is recorded as fetched.
     *
     * @return number of rows written
     */
    int put(List<BarRecord> bars) throws CacheException;

    /**
     * Upsert bars fetched for a range. The whole range is recorded as fetched,
     * including days for which the provider returned nothing.
     */
    int put(SeriesKey key, DateRange fetchedRange, List<BarRecord> bars) throws CacheException;

    CoverageSummary coverage(SeriesKey key) throws CacheException;

    /**
     * Delete rows cached longer ago than {@code olderThan}.
     *
     * @return number of rows deleted
     */
    int purgeStale(Duration olderThan) throws CacheException;

    int invalidate(String symbol) throws CacheException;

    int invalidateBefore(LocalDate date) throws CacheException;

    int invalidateAll() throws CacheException;

    CacheStats stats() throws CacheException;

    /**
     * Cached series, filtered by exchange and interval when they are non-null.
     */
    List<SeriesKey> listSeries(String exchange, Interval interval) throws CacheException;

    List<LocalDate> tradingDates(SeriesKey key) throws CacheException;

    boolean checkIntegrity() throws CacheException;

    @Override
    void close();
}
