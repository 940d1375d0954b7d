package com.barcache.service.data.sqlite;

import com.barcache.core.exception.CacheException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.data.BarCache;
import com.barcache.service.data.CacheLookup;
import com.barcache.service.data.CacheStats;
import com.barcache.service.data.sqlite.dao.BarDao;
import com.barcache.service.data.sqlite.dao.CoverageDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite implementation of the bar cache.
 * One database file holds every series; fetched date ranges are tracked next to the rows.
 */
public class SqliteBarCache implements BarCache {

    private static final Logger log = LoggerFactory.getLogger(SqliteBarCache.class);

    private final SqliteConnection conn;
    private final BarDao bars;
    private final CoverageDao coverage;
    private final Duration ttl;
    private final Clock clock;

    public SqliteBarCache(Path dbFile, Duration ttl, Clock clock) throws CacheException {
        this.conn = new SqliteConnection(dbFile);
        this.bars = new BarDao(conn);
        this.coverage = new CoverageDao(conn);
        this.ttl = ttl;
        this.clock = clock;
        try {
            SqliteSchema.initialize(conn);
        } catch (SQLException e) {
            conn.close();
            throw new CacheException("SQLite error initializing bar cache at " + dbFile + ": " + e.getMessage(), e);
        }
    }

    public Path getDbFile() {
        return conn.getDbFile();
    }

    // ========== Reads ==========

    @Override
    public CacheLookup get(SeriesKey key, LocalDate from, LocalDate to) throws CacheException {
        DateRange requested = new DateRange(from, to);
        try {
            List<BarRecord> rows = bars.query(key, from, to);
            CoverageSummary summary = summarize(key);

            List<DateRange> missing = missingRanges(key, requested, summary);

            if (log.isDebugEnabled()) {
                log.debug("Cache lookup {} {}: {} rows, missing {}", key, requested, rows.size(), missing);
            }
            return new CacheLookup(rows, missing, summary);
        } catch (SQLException e) {
            throw new CacheException("SQLite error reading " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Unfetched holes, plus everything the cached bars cannot answer: the whole request once the
     * newest bar has outlived the TTL, otherwise the days after the newest bar.
     */
    private List<DateRange> missingRanges(SeriesKey key, DateRange requested, CoverageSummary summary)
            throws SQLException {
        Instant now = clock.instant();
        if (summary.isFresh(requested.to(), now, ttl)) {
            return coverage.findGaps(key, requested);
        }
        if (!summary.isWithinTtl(now, ttl)) {
            return List.of(requested);
        }

        List<DateRange> missing = new ArrayList<>(coverage.findGaps(key, requested));
        LocalDate newest = summary.maxDate();
        LocalDate tailStart = requested.from().isAfter(newest) ? requested.from() : newest.plusDays(1);
        missing.add(new DateRange(tailStart, requested.to()));
        return DateRange.mergeAll(missing);
    }

    @Override
    public CoverageSummary coverage(SeriesKey key) throws CacheException {
        try {
            return summarize(key);
        } catch (SQLException e) {
            throw new CacheException("SQLite error reading coverage of " + key + ": " + e.getMessage(), e);
        }
    }

    private CoverageSummary summarize(SeriesKey key) throws SQLException {
        BarDao.SeriesStats stats = bars.getSeriesStats(key);
        CoverageDao.CoverageRange latest = coverage.getLatestRange(key);

        if (stats.rowCount() == 0 && latest == null) {
            return CoverageSummary.empty(key);
        }

        LocalDate coveredThrough = latest != null ? latest.to() : null;
        if (stats.maxDay() != null && (coveredThrough == null || stats.maxDay().isAfter(coveredThrough))) {
            coveredThrough = stats.maxDay();
        }
        Instant coveredAt = latest != null ? latest.updatedAt() : null;

        return new CoverageSummary(key, stats.minDay(), stats.maxDay(), stats.rowCount(),
            stats.lastCachedAt(), coveredThrough, coveredAt);
    }

    @Override
    public List<SeriesKey> listSeries(String exchange, Interval interval) throws CacheException {
        try {
            return bars.listSeries(exchange, interval);
        } catch (SQLException e) {
            throw new CacheException("SQLite error listing series: " + e.getMessage(), e);
        }
    }

    @Override
    public List<LocalDate> tradingDates(SeriesKey key) throws CacheException {
        try {
            return bars.getTradeDates(key);
        } catch (SQLException e) {
            throw new CacheException("SQLite error reading trade dates of " + key + ": " + e.getMessage(), e);
        }
    }

    // ========== Writes ==========

    @Override
    public int put(List<BarRecord> rows) throws CacheException {
        if (rows.isEmpty()) {
            return 0;
        }
        Map<SeriesKey, DateRange> spans = new LinkedHashMap<>();
        for (BarRecord row : rows) {
            spans.merge(row.key(), DateRange.singleDay(row.tradeDate()), DateRange::merge);
        }
        try {
            long now = clock.millis();
            return conn.executeInTransaction(c -> {
                int written = bars.upsertBatch(rows, now);
                for (Map.Entry<SeriesKey, DateRange> span : spans.entrySet()) {
                    coverage.addCoverage(span.getKey(), span.getValue(), now);
                }
                return written;
            });
        } catch (SQLException e) {
            throw new CacheException("SQLite error writing " + rows.size() + " bars: " + e.getMessage(), e);
        }
    }

    @Override
    public int put(SeriesKey key, DateRange fetchedRange, List<BarRecord> rows) throws CacheException {
        DateRange covered = fetchedRange;
        for (BarRecord row : rows) {
            if (!row.key().equals(key)) {
                throw new IllegalArgumentException("Bar " + row.key() + " does not belong to " + key);
            }
            covered = covered.merge(DateRange.singleDay(row.tradeDate()));
        }
        DateRange toRecord = covered;
        try {
            long now = clock.millis();
            int written = conn.executeInTransaction(c -> {
                int n = bars.upsertBatch(rows, now);
                coverage.addCoverage(key, toRecord, now);
                return n;
            });
            log.debug("Cached {} bars for {} {}", written, key, fetchedRange);
            return written;
        } catch (SQLException e) {
            throw new CacheException("SQLite error writing bars for " + key + ": " + e.getMessage(), e);
        }
    }

    // ========== Maintenance ==========

    @Override
    public int purgeStale(Duration olderThan) throws CacheException {
        long cutoff = clock.instant().minus(olderThan).toEpochMilli();
        try {
            int deleted = conn.executeInTransaction(c -> {
                List<SeriesKey> affected = bars.listSeriesCachedBefore(cutoff);
                int n = bars.deleteCachedBefore(cutoff);
                for (SeriesKey key : affected) {
                    rebuildCoverage(key);
                }
                return n;
            });
            log.info("Purged {} bars cached before {}", deleted, Instant.ofEpochMilli(cutoff));
            return deleted;
        } catch (SQLException e) {
            throw new CacheException("SQLite error purging stale bars: " + e.getMessage(), e);
        }
    }

    /**
     * Coverage of a series after rows were removed: the span of what is left, or nothing.
     */
    private void rebuildCoverage(SeriesKey key) throws SQLException {
        BarDao.SeriesStats stats = bars.getSeriesStats(key);
        if (stats.rowCount() == 0) {
            coverage.deleteSeries(key);
            return;
        }
        Instant newest = bars.getNewestCachedAt(key);
        coverage.replaceCoverage(key, new DateRange(stats.minDay(), stats.maxDay()), newest.toEpochMilli());
    }

    @Override
    public int invalidate(String symbol) throws CacheException {
        try {
            int deleted = conn.executeInTransaction(c -> {
                int n = bars.deleteSymbol(symbol);
                coverage.deleteSymbol(symbol);
                return n;
            });
            log.info("Invalidated {} bars for {}", deleted, symbol);
            return deleted;
        } catch (SQLException e) {
            throw new CacheException("SQLite error invalidating " + symbol + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int invalidateBefore(LocalDate date) throws CacheException {
        try {
            int deleted = conn.executeInTransaction(c -> {
                int n = bars.deleteBefore(date);
                coverage.deleteBefore(date);
                return n;
            });
            log.info("Invalidated {} bars before {}", deleted, date);
            return deleted;
        } catch (SQLException e) {
            throw new CacheException("SQLite error invalidating bars before " + date + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int invalidateAll() throws CacheException {
        try {
            int deleted = conn.executeInTransaction(c -> {
                int n = bars.deleteAll();
                coverage.deleteAll();
                return n;
            });
            log.info("Invalidated entire cache ({} bars)", deleted);
            return deleted;
        } catch (SQLException e) {
            throw new CacheException("SQLite error clearing cache: " + e.getMessage(), e);
        }
    }

    @Override
    public CacheStats stats() throws CacheException {
        try {
            return new CacheStats(bars.countRows(), bars.countSymbols(), bars.countSeries(), databaseSize());
        } catch (SQLException e) {
            throw new CacheException("SQLite error reading cache stats: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CacheException("Cannot read size of " + conn.getDbFile() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Size of the database file plus its write-ahead log.
     */
    private long databaseSize() throws IOException {
        Path db = conn.getDbFile();
        long size = Files.exists(db) ? Files.size(db) : 0;
        Path wal = db.resolveSibling(db.getFileName() + "-wal");
        if (Files.exists(wal)) {
            size += Files.size(wal);
        }
        return size;
    }

    @Override
    public boolean checkIntegrity() throws CacheException {
        try {
            Connection c = conn.getConnection();
            try (Statement stmt = c.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA integrity_check")) {
                String result = rs.next() ? rs.getString(1) : "no result";
                if (!"ok".equalsIgnoreCase(result)) {
                    log.error("SQLite integrity check failed for {}: {}", conn.getDbFile(), result);
                    return false;
                }
                return true;
            }
        } catch (SQLException e) {
            throw new CacheException("SQLite error checking integrity: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        conn.close();
    }
}
