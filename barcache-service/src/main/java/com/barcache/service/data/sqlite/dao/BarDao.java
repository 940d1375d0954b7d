package com.barcache.service.data.sqlite.dao;

import com.barcache.core.model.BarRecord;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.data.sqlite.SqliteConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for OHLCV bars of every series in one table.
 */
public class BarDao {

    private static final Logger log = LoggerFactory.getLogger(BarDao.class);

    private static final int BATCH_SIZE = 1000;

    private final SqliteConnection conn;

    public BarDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Upsert bars in one transaction. A second write of the same
     * (symbol, exchange, interval, timestamp) replaces the first.
     */
    public int upsertBatch(List<BarRecord> bars, long cachedAtMillis) throws SQLException {
        if (bars.isEmpty()) {
            return 0;
        }

        return conn.executeInTransaction(c -> {
            String sql = """
                INSERT OR REPLACE INTO bars
                (symbol, exchange, bar_interval, timestamp, trade_day,
                 open, high, low, close, volume, cached_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

            int count = 0;
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                for (BarRecord bar : bars) {
                    stmt.setString(1, bar.symbol());
                    stmt.setString(2, bar.exchange());
                    stmt.setString(3, bar.interval().name());
                    stmt.setLong(4, bar.timestamp().toEpochMilli());
                    stmt.setLong(5, bar.tradeDate().toEpochDay());
                    stmt.setDouble(6, bar.open());
                    stmt.setDouble(7, bar.high());
                    stmt.setDouble(8, bar.low());
                    stmt.setDouble(9, bar.close());
                    stmt.setLong(10, bar.volume());
                    stmt.setLong(11, cachedAtMillis);
                    stmt.addBatch();

                    if (++count % BATCH_SIZE == 0) {
                        stmt.executeBatch();
                    }
                }
                stmt.executeBatch();
            }

            log.debug("Upserted {} bars", bars.size());
            return bars.size();
        });
    }

    /**
     * Bars of a series whose trade date lies in [fromDay, toDay], ordered by timestamp.
     */
    public List<BarRecord> query(SeriesKey key, LocalDate fromDay, LocalDate toDay) throws SQLException {
        Connection c = conn.getConnection();
        List<BarRecord> bars = new ArrayList<>();

        String sql = """
            SELECT timestamp, trade_day, open, high, low, close, volume, cached_at
            FROM bars
            WHERE symbol = ? AND exchange = ? AND bar_interval = ?
              AND trade_day >= ? AND trade_day <= ?
            ORDER BY timestamp
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bindKey(stmt, key);
            stmt.setLong(4, fromDay.toEpochDay());
            stmt.setLong(5, toDay.toEpochDay());

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    bars.add(readBar(key, rs));
                }
            }
        }

        return bars;
    }

    /**
     * Row statistics for one series. Zero count and null dates when the series is absent.
     */
    public SeriesStats getSeriesStats(SeriesKey key) throws SQLException {
        Connection c = conn.getConnection();

        String sql = """
            SELECT MIN(trade_day), MAX(trade_day), COUNT(*)
            FROM bars
            WHERE symbol = ? AND exchange = ? AND bar_interval = ?
            """;

        long count;
        LocalDate minDay = null;
        LocalDate maxDay = null;
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bindKey(stmt, key);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                count = rs.getLong(3);
                if (count > 0) {
                    minDay = LocalDate.ofEpochDay(rs.getLong(1));
                    maxDay = LocalDate.ofEpochDay(rs.getLong(2));
                }
            }
        }

        if (count == 0) {
            return new SeriesStats(null, null, 0, null);
        }

        Instant lastCachedAt = null;
        String cachedSql = """
            SELECT MAX(cached_at) FROM bars
            WHERE symbol = ? AND exchange = ? AND bar_interval = ? AND trade_day = ?
            """;
        try (PreparedStatement stmt = c.prepareStatement(cachedSql)) {
            bindKey(stmt, key);
            stmt.setLong(4, maxDay.toEpochDay());
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    lastCachedAt = Instant.ofEpochMilli(rs.getLong(1));
                }
            }
        }

        return new SeriesStats(minDay, maxDay, count, lastCachedAt);
    }

    /**
     * Latest cached_at over every row of the series, or null when it has none.
     */
    public Instant getNewestCachedAt(SeriesKey key) throws SQLException {
        Connection c = conn.getConnection();
        String sql = """
            SELECT MAX(cached_at) FROM bars
            WHERE symbol = ? AND exchange = ? AND bar_interval = ?
            """;
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bindKey(stmt, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    long value = rs.getLong(1);
                    return rs.wasNull() ? null : Instant.ofEpochMilli(value);
                }
            }
        }
        return null;
    }

    /**
     * Distinct trade dates of a series in ascending order.
     */
    public List<LocalDate> getTradeDates(SeriesKey key) throws SQLException {
        Connection c = conn.getConnection();
        List<LocalDate> dates = new ArrayList<>();

        String sql = """
            SELECT DISTINCT trade_day FROM bars
            WHERE symbol = ? AND exchange = ? AND bar_interval = ?
            ORDER BY trade_day
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bindKey(stmt, key);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    dates.add(LocalDate.ofEpochDay(rs.getLong(1)));
                }
            }
        }
        return dates;
    }

    /**
     * Series present in the table, optionally filtered by exchange and interval (null = any).
     */
    public List<SeriesKey> listSeries(String exchange, Interval interval) throws SQLException {
        Connection c = conn.getConnection();
        List<SeriesKey> keys = new ArrayList<>();

        String sql = """
            SELECT DISTINCT symbol, exchange, bar_interval FROM bars
            WHERE (? IS NULL OR exchange = ?) AND (? IS NULL OR bar_interval = ?)
            ORDER BY symbol, exchange, bar_interval
            """;

        String exchangeFilter = exchange == null ? null : exchange.trim().toUpperCase();
        String intervalFilter = interval == null ? null : interval.name();
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, exchangeFilter);
            stmt.setString(2, exchangeFilter);
            stmt.setString(3, intervalFilter);
            stmt.setString(4, intervalFilter);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(new SeriesKey(rs.getString(1), rs.getString(2),
                        Interval.valueOf(rs.getString(3))));
                }
            }
        }
        return keys;
    }

    /**
     * Series that have at least one row cached before the cutoff.
     */
    public List<SeriesKey> listSeriesCachedBefore(long cutoffMillis) throws SQLException {
        Connection c = conn.getConnection();
        List<SeriesKey> keys = new ArrayList<>();
        String sql = "SELECT DISTINCT symbol, exchange, bar_interval FROM bars WHERE cached_at < ?";
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setLong(1, cutoffMillis);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(new SeriesKey(rs.getString(1), rs.getString(2),
                        Interval.valueOf(rs.getString(3))));
                }
            }
        }
        return keys;
    }

    public int deleteCachedBefore(long cutoffMillis) throws SQLException {
        return executeUpdate("DELETE FROM bars WHERE cached_at < ?", stmt -> stmt.setLong(1, cutoffMillis));
    }

    public int deleteSymbol(String symbol) throws SQLException {
        return executeUpdate("DELETE FROM bars WHERE symbol = ?",
            stmt -> stmt.setString(1, symbol.trim().toUpperCase()));
    }

    public int deleteBefore(LocalDate date) throws SQLException {
        return executeUpdate("DELETE FROM bars WHERE trade_day < ?",
            stmt -> stmt.setLong(1, date.toEpochDay()));
    }

    public int deleteAll() throws SQLException {
        return executeUpdate("DELETE FROM bars", stmt -> { });
    }

    public long countRows() throws SQLException {
        return queryLong("SELECT COUNT(*) FROM bars");
    }

    public long countSymbols() throws SQLException {
        return queryLong("SELECT COUNT(DISTINCT symbol) FROM bars");
    }

    public long countSeries() throws SQLException {
        return queryLong("SELECT COUNT(*) FROM (SELECT DISTINCT symbol, exchange, bar_interval FROM bars)");
    }

    private long queryLong(String sql) throws SQLException {
        Connection c = conn.getConnection();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private int executeUpdate(String sql, StatementBinder binder) throws SQLException {
        return conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                binder.bind(stmt);
                return stmt.executeUpdate();
            }
        });
    }

    private static void bindKey(PreparedStatement stmt, SeriesKey key) throws SQLException {
        stmt.setString(1, key.symbol());
        stmt.setString(2, key.exchange());
        stmt.setString(3, key.interval().name());
    }

    private static BarRecord readBar(SeriesKey key, ResultSet rs) throws SQLException {
        return new BarRecord(
            key.symbol(),
            key.exchange(),
            key.interval(),
            Instant.ofEpochMilli(rs.getLong("timestamp")),
            LocalDate.ofEpochDay(rs.getLong("trade_day")),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getLong("volume"),
            Instant.ofEpochMilli(rs.getLong("cached_at"))
        );
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    /**
     * Row statistics for one series.
     */
    public record SeriesStats(
        LocalDate minDay,
        LocalDate maxDay,
        long rowCount,
        Instant lastCachedAt
    ) {
    }
}
