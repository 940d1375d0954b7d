package com.barcache.service.data.sqlite.dao;

import com.barcache.core.model.DateRange;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.data.sqlite.SqliteConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for the date ranges already fetched per series.
 * A fetched range covers its holidays and weekends even though no bars exist for them.
 */
public class CoverageDao {

    private static final Logger log = LoggerFactory.getLogger(CoverageDao.class);

    private final SqliteConnection conn;

    public CoverageDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Add a fetched range, merging it with every overlapping or adjacent range.
     * The merged range keeps the refresh time of whichever range reaches furthest.
     */
    public void addCoverage(SeriesKey key, DateRange range, long updatedMillis) throws SQLException {
        long rangeStart = range.from().toEpochDay();
        long rangeEnd = range.to().toEpochDay();

        conn.executeInTransaction(c -> {
            List<CoverageRange> overlapping = new ArrayList<>();
            String selectSql = """
                SELECT range_start, range_end, last_updated
                FROM fetch_coverage
                WHERE symbol = ? AND exchange = ? AND bar_interval = ?
                  AND range_start <= ? AND range_end >= ?
                ORDER BY range_start
                """;

            try (PreparedStatement stmt = c.prepareStatement(selectSql)) {
                bindKey(stmt, key);
                stmt.setLong(4, rangeEnd + 1);   // adjacent on the right
                stmt.setLong(5, rangeStart - 1); // adjacent on the left
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        overlapping.add(readRange(rs));
                    }
                }
            }

            long mergedStart = rangeStart;
            long mergedEnd = rangeEnd;
            long mergedUpdated = updatedMillis;
            for (CoverageRange r : overlapping) {
                mergedStart = Math.min(mergedStart, r.rangeStart());
                if (r.rangeEnd() > mergedEnd) {
                    mergedEnd = r.rangeEnd();
                    mergedUpdated = r.lastUpdated();
                }
            }

            if (!overlapping.isEmpty()) {
                String deleteSql = """
                    DELETE FROM fetch_coverage
                    WHERE symbol = ? AND exchange = ? AND bar_interval = ?
                      AND range_start <= ? AND range_end >= ?
                    """;
                try (PreparedStatement stmt = c.prepareStatement(deleteSql)) {
                    bindKey(stmt, key);
                    stmt.setLong(4, rangeEnd + 1);
                    stmt.setLong(5, rangeStart - 1);
                    stmt.executeUpdate();
                }
            }

            insertRange(c, key, mergedStart, mergedEnd, mergedUpdated);

            if (overlapping.size() > 1) {
                log.debug("Coverage compacted: merged {} ranges into 1 for {} [{} - {}]",
                    overlapping.size(), key, LocalDate.ofEpochDay(mergedStart), LocalDate.ofEpochDay(mergedEnd));
            }
        });
    }

    public List<CoverageRange> getCoverageRanges(SeriesKey key) throws SQLException {
        Connection c = conn.getConnection();
        List<CoverageRange> ranges = new ArrayList<>();

        String sql = """
            SELECT range_start, range_end, last_updated
            FROM fetch_coverage
            WHERE symbol = ? AND exchange = ? AND bar_interval = ?
            ORDER BY range_start
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bindKey(stmt, key);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ranges.add(readRange(rs));
                }
            }
        }
        return ranges;
    }

    /**
     * The range that reaches furthest into the future, or null when nothing was fetched.
     */
    public CoverageRange getLatestRange(SeriesKey key) throws SQLException {
        List<CoverageRange> ranges = getCoverageRanges(key);
        return ranges.isEmpty() ? null : ranges.get(ranges.size() - 1);
    }

    /**
     * Sub-ranges of [from, to] not covered by any fetched range.
     */
    public List<DateRange> findGaps(SeriesKey key, DateRange requested) throws SQLException {
        List<DateRange> gaps = new ArrayList<>();
        LocalDate cursor = requested.from();

        for (CoverageRange range : getCoverageRanges(key)) {
            LocalDate start = range.from();
            LocalDate end = range.to();
            if (end.isBefore(cursor)) {
                continue;
            }
            if (start.isAfter(requested.to())) {
                break;
            }
            if (start.isAfter(cursor)) {
                gaps.add(new DateRange(cursor, start.minusDays(1)));
            }
            cursor = end.plusDays(1);
            if (cursor.isAfter(requested.to())) {
                return gaps;
            }
        }

        if (!cursor.isAfter(requested.to())) {
            gaps.add(new DateRange(cursor, requested.to()));
        }
        return gaps;
    }

    /**
     * Replace all ranges of a series with a single range.
     */
    public void replaceCoverage(SeriesKey key, DateRange range, long updatedMillis) throws SQLException {
        conn.executeInTransaction(c -> {
            deleteSeries(key);
            insertRange(c, key, range.from().toEpochDay(), range.to().toEpochDay(), updatedMillis);
        });
    }

    public void deleteSeries(SeriesKey key) throws SQLException {
        conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement(
                    "DELETE FROM fetch_coverage WHERE symbol = ? AND exchange = ? AND bar_interval = ?")) {
                bindKey(stmt, key);
                stmt.executeUpdate();
            }
        });
    }

    public void deleteSymbol(String symbol) throws SQLException {
        conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement(
                    "DELETE FROM fetch_coverage WHERE symbol = ?")) {
                stmt.setString(1, symbol.trim().toUpperCase());
                stmt.executeUpdate();
            }
        });
    }

    /**
     * Forget coverage before a date: ranges ending before it go, ranges straddling it start at it.
     */
    public void deleteBefore(LocalDate date) throws SQLException {
        long day = date.toEpochDay();
        conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement(
                    "DELETE FROM fetch_coverage WHERE range_end < ?")) {
                stmt.setLong(1, day);
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = c.prepareStatement(
                    "UPDATE fetch_coverage SET range_start = ? WHERE range_start < ?")) {
                stmt.setLong(1, day);
                stmt.setLong(2, day);
                stmt.executeUpdate();
            }
        });
    }

    public void deleteAll() throws SQLException {
        conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement("DELETE FROM fetch_coverage")) {
                stmt.executeUpdate();
            }
        });
    }

    private static void insertRange(Connection c, SeriesKey key, long start, long end, long updated)
            throws SQLException {
        String insertSql = """
            INSERT OR REPLACE INTO fetch_coverage
            (symbol, exchange, bar_interval, range_start, range_end, last_updated)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement stmt = c.prepareStatement(insertSql)) {
            bindKey(stmt, key);
            stmt.setLong(4, start);
            stmt.setLong(5, end);
            stmt.setLong(6, updated);
            stmt.executeUpdate();
        }
    }

    private static void bindKey(PreparedStatement stmt, SeriesKey key) throws SQLException {
        stmt.setString(1, key.symbol());
        stmt.setString(2, key.exchange());
        stmt.setString(3, key.interval().name());
    }

    private static CoverageRange readRange(ResultSet rs) throws SQLException {
        return new CoverageRange(
            rs.getLong("range_start"),
            rs.getLong("range_end"),
            rs.getLong("last_updated")
        );
    }

    /**
     * Fetched range in epoch days, both ends inclusive.
     */
    public record CoverageRange(long rangeStart, long rangeEnd, long lastUpdated) {

        public LocalDate from() {
            return LocalDate.ofEpochDay(rangeStart);
        }

        public LocalDate to() {
            return LocalDate.ofEpochDay(rangeEnd);
        }

        public Instant updatedAt() {
            return Instant.ofEpochMilli(lastUpdated);
        }
    }
}
