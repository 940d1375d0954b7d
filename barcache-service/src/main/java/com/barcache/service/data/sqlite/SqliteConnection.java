package com.barcache.service.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Manages the SQLite connection for the bar cache database file.
 * WAL mode lets readers proceed while a write transaction is open;
 * writes are serialized through {@link #executeInTransaction}.
 */
public class SqliteConnection {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final Path dbFile;
    private volatile Connection connection;
    private final Object lock = new Object();

    public SqliteConnection(Path dbFile) {
        this.dbFile = dbFile;
    }

    public Path getDbFile() {
        return dbFile;
    }

    /**
     * Get or create the connection. Not synchronized on the fast path so readers never block.
     */
    public Connection getConnection() throws SQLException {
        Connection conn = connection;
        if (conn != null && !conn.isClosed()) {
            return conn;
        }

        synchronized (lock) {
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        Path parentDir = dbFile.toAbsolutePath().getParent();
        if (parentDir != null) {
            try {
                Files.createDirectories(parentDir);
            } catch (IOException e) {
                throw new SQLException("Cannot create database directory " + parentDir, e);
            }
        }

        String url = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        Connection conn = DriverManager.getConnection(url);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");

            // Committed bars must survive a crash
            stmt.execute("PRAGMA synchronous=FULL");

            // 64MB page cache
            stmt.execute("PRAGMA cache_size=-65536");

            stmt.execute("PRAGMA busy_timeout=5000");
        }

        log.debug("Opened SQLite connection at {}", dbFile.toAbsolutePath());
        return conn;
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on failure. A nested call from inside
     * a running transaction joins it.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            boolean autoCommitOriginal = conn.getAutoCommit();
            if (!autoCommitOriginal) {
                return function.apply(conn);
            }
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            } finally {
                restoreAutoCommit(conn);
            }
        }
    }

    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    private void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit on {}: {}", dbFile, e.getMessage());
        }
    }

    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbFile);
                } catch (SQLException e) {
                    log.warn("Error closing connection at {}: {}", dbFile, e.getMessage());
                }
                connection = null;
            }
        }
    }

    public boolean exists() {
        return Files.exists(dbFile);
    }

    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
