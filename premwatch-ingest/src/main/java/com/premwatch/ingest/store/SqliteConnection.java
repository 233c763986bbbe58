package com.premwatch.ingest.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Manages the SQLite connection for one ingest database file.
 * Writes are serialized through executeInTransaction().
 */
public class SqliteConnection {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final File dbFile;
    private Connection connection;
    private boolean closed;
    private final Object lock = new Object();

    private SqliteConnection(File dbFile) {
        this.dbFile = dbFile;
    }

    /**
     * Open (or create) the database at the given path.
     * Fails immediately if the file cannot be opened.
     */
    public static SqliteConnection open(Path dbPath) throws SQLException {
        SqliteConnection conn = new SqliteConnection(dbPath.toAbsolutePath().toFile());
        conn.getConnection();
        return conn;
    }

    /**
     * Get the SQLite connection, creating it on first use.
     */
    public Connection getConnection() throws SQLException {
        Connection conn = connection;
        if (conn != null && !conn.isClosed()) {
            return conn;
        }

        synchronized (lock) {
            if (closed) {
                throw new SQLException("Connection to " + dbFile + " has been closed");
            }
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        File parentDir = dbFile.getParentFile();
        if (parentDir != null && !parentDir.exists()) {
            parentDir.mkdirs();
        }

        String url = "jdbc:sqlite:" + dbFile.getAbsolutePath();
        Connection conn = DriverManager.getConnection(url);

        try (Statement stmt = conn.createStatement()) {
            // WAL mode so readers (e.g. a sqlite3 shell) don't block the loader
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA foreign_keys=ON");
            stmt.execute("PRAGMA cache_size=-32768"); // 32MB cache
        }

        log.debug("Created SQLite connection at {}", dbFile.getAbsolutePath());
        return conn;
    }

    /**
     * Execute a function within a transaction.
     * Automatically commits on success, rolls back on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            boolean autoCommitOriginal = conn.getAutoCommit();
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
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException e) {
                    log.debug("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * Execute a void function within a transaction.
     */
    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    /**
     * Close the connection. Safe to call more than once.
     */
    public void close() {
        synchronized (lock) {
            closed = true;
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection for {}", dbFile.getName());
                } catch (SQLException e) {
                    log.warn("Error closing connection for {}: {}", dbFile.getName(), e.getMessage());
                }
                connection = null;
            }
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Functional interface for transactional operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for transactional operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
