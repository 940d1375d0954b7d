package com.barcache.service.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates and versions the bar cache schema.
 */
public class SqliteSchema {

    private static final Logger log = LoggerFactory.getLogger(SqliteSchema.class);

    public static final int CURRENT_VERSION = 1;

    private SqliteSchema() {
    }

    public static void initialize(SqliteConnection conn) throws SQLException {
        conn.executeInTransaction(c -> {
            int currentVersion = getSchemaVersion(c);

            if (currentVersion == 0) {
                createAllTables(c);
                setSchemaVersion(c, CURRENT_VERSION);
                log.info("Created bar cache schema v{} at {}", CURRENT_VERSION, conn.getDbFile());
            } else if (currentVersion > CURRENT_VERSION) {
                throw new SQLException("Bar cache schema v" + currentVersion
                    + " is newer than supported v" + CURRENT_VERSION);
            } else {
                log.debug("Bar cache schema v{} up to date", currentVersion);
            }
        });
    }

    private static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL
                )
                """);

            // BARS: timestamp is epoch millis, trade_day is epoch day in the market zone
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS bars (
                    symbol TEXT NOT NULL,
                    exchange TEXT NOT NULL,
                    bar_interval TEXT NOT NULL,
                    timestamp INTEGER NOT NULL,
                    trade_day INTEGER NOT NULL,
                    open REAL NOT NULL,
                    high REAL NOT NULL,
                    low REAL NOT NULL,
                    close REAL NOT NULL,
                    volume INTEGER NOT NULL,
                    cached_at INTEGER NOT NULL,
                    PRIMARY KEY (symbol, exchange, bar_interval, timestamp)
                ) WITHOUT ROWID
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_bars_series_day
                ON bars(symbol, exchange, bar_interval, trade_day)
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_bars_cached_at
                ON bars(cached_at)
                """);

            // FETCH COVERAGE: date ranges already requested from the provider, in epoch days
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS fetch_coverage (
                    symbol TEXT NOT NULL,
                    exchange TEXT NOT NULL,
                    bar_interval TEXT NOT NULL,
                    range_start INTEGER NOT NULL,
                    range_end INTEGER NOT NULL,
                    last_updated INTEGER NOT NULL,
                    PRIMARY KEY (symbol, exchange, bar_interval, range_start)
                ) WITHOUT ROWID
                """);
        }
    }
}
