package de.bsommerfeld.canvas.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * One long-lived SQLite connection in WAL mode.
 *
 * <h3>Why a single connection</h3>
 * In WAL mode SQLite appends committed pages to a {@code -wal} file next to
 * the database and merges them back lazily. The merge is only forced by a
 * checkpoint, and the WAL is only removed when the last connection closes.
 * Holding exactly one connection lets {@link #checkpointAndClose()} leave a
 * self-contained database file behind when the application exits.
 *
 * <h3>Threading</h3>
 * All access goes through {@link #withConnection}, which serializes callers
 * on this object's monitor. SQLite serializes writes at the file level
 * anyway.
 */
public class SqliteDatabase implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    /** Work executed against the open connection. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final String name;
    private final String url;
    private Connection connection;

    SqliteDatabase(String name, String url) {
        this.name = name;
        this.url = url;
    }

    /**
     * Opens (creating if needed) the database file and applies
     * {@code schema/<schema>.sql}.
     *
     * @throws DatabaseException if the file cannot be opened or the schema fails
     */
    public static SqliteDatabase open(String name, Path file, String schema) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            LOG.error("Failed to create directory for {}", file, e);
        }
        SqliteDatabase database = new SqliteDatabase(name, "jdbc:sqlite:" + file.toAbsolutePath());
        database.initialize(schema);
        return database;
    }

    /** Opens a private in-memory database, used in TEST mode and tests. */
    public static SqliteDatabase inMemory(String name, String schema) {
        SqliteDatabase database = new SqliteDatabase(name, "jdbc:sqlite::memory:");
        database.initialize(schema);
        return database;
    }

    public String getName() {
        return name;
    }

    public synchronized boolean isOpen() {
        try {
            return connection != null && !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    private synchronized void initialize(String schema) {
        LOG.info("Opening {} database at {}", name, url);
        try {
            connection = DriverManager.getConnection(url);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            applySchema(schema);
        } catch (SQLException e) {
            closeQuietly();
            throw new DatabaseException("Database initialization failed: " + name, e);
        }
    }

    /**
     * Applies every DDL statement of the schema in one transaction. All
     * statements use {@code IF NOT EXISTS}, so re-running on an existing file
     * is safe.
     */
    private void applySchema(String schema) throws SQLException {
        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            for (String sql : SqlLoader.loadScript(schema)) {
                stmt.execute(sql);
            }
            connection.commit();
            LOG.info("Schema '{}' applied to {} database.", schema, name);
        } catch (SQLException | IllegalStateException e) {
            connection.rollback();
            throw new SQLException("Schema application failed: " + schema, e);
        } finally {
            connection.setAutoCommit(true);
        }
    }

    /**
     * Runs work against the connection.
     *
     * @throws DatabaseException if the database is closed or the work fails
     */
    public synchronized <T> T withConnection(SqlWork<T> work) {
        if (!isOpen()) {
            throw new DatabaseException(name + " database is closed", null);
        }
        try {
            return work.apply(connection);
        } catch (SQLException e) {
            throw new DatabaseException(name + " database operation failed", e);
        }
    }

    /**
     * Runs work inside a transaction, rolling back if it throws.
     *
     * @throws DatabaseException if the database is closed or the work fails
     */
    public synchronized <T> T inTransaction(SqlWork<T> work) {
        return withConnection(conn -> {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        });
    }

    /**
     * Merges the write-ahead log into the main database file and truncates
     * the WAL to zero bytes.
     *
     * @throws SQLException if the checkpoint cannot run
     */
    public synchronized void checkpoint() throws SQLException {
        if (!isOpen()) {
            return;
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        }
        LOG.debug("WAL checkpoint done for {} database", name);
    }

    /**
     * Checkpoints, then closes. The connection is closed even if the
     * checkpoint fails; the checkpoint failure is rethrown afterwards.
     */
    public synchronized void checkpointAndClose() throws SQLException {
        try {
            checkpoint();
        } finally {
            close();
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            LOG.info("{} database closed.", name);
        } finally {
            connection = null;
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (SQLException e) {
            LOG.warn("Failed to close {} database after initialization error", name, e);
        }
    }
}
