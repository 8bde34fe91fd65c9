package de.bsommerfeld.canvas.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class SqliteDatabaseTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @AfterEach
    void tearDown() throws SQLException {
        if (database != null) {
            database.close();
        }
    }

    @Test
    void open_shouldCreateFileAndApplySchema() {
        Path file = tempDir.resolve("nested").resolve("history.db");
        database = SqliteDatabase.open("history", file, "history");

        assertTrue(Files.exists(file));
        assertTrue(database.isOpen());
        int count = database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM history_entries")) {
                return rs.next() ? rs.getInt(1) : -1;
            }
        });
        assertEquals(0, count);
    }

    @Test
    void open_shouldUseWalJournal() {
        database = SqliteDatabase.open("library", tempDir.resolve("canvas.db"), "library");

        String mode = database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
                return rs.next() ? rs.getString(1) : null;
            }
        });
        assertEquals("wal", mode.toLowerCase());
    }

    @Test
    void open_shouldFailForUnknownSchema() {
        assertThrows(DatabaseException.class,
                () -> SqliteDatabase.open("broken", tempDir.resolve("broken.db"), "missing"));
    }

    @Test
    void checkpointAndClose_shouldLeaveNoPendingWal() throws SQLException {
        Path file = tempDir.resolve("history.db");
        database = SqliteDatabase.open("history", file, "history");
        insertEntry("a.png");
        insertEntry("b.png");

        database.checkpointAndClose();

        assertFalse(database.isOpen());
        Path wal = tempDir.resolve("history.db-wal");
        assertTrue(!Files.exists(wal) || sizeOf(wal) == 0);

        database = SqliteDatabase.open("history", file, "history");
        int count = database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM history_entries")) {
                return rs.next() ? rs.getInt(1) : -1;
            }
        });
        assertEquals(2, count);
    }

    @Test
    void checkpoint_shouldTruncateWalWhileOpen() throws SQLException {
        database = SqliteDatabase.open("history", tempDir.resolve("history.db"), "history");
        insertEntry("a.png");

        database.checkpoint();

        Path wal = tempDir.resolve("history.db-wal");
        assertTrue(!Files.exists(wal) || sizeOf(wal) == 0);
        assertTrue(database.isOpen());
    }

    @Test
    void withConnection_shouldThrowWhenClosed() throws SQLException {
        database = SqliteDatabase.inMemory("memory", "history");
        database.close();

        assertThrows(DatabaseException.class, () -> database.withConnection(conn -> 1));
    }

    @Test
    void close_shouldBeIdempotent() throws SQLException {
        database = SqliteDatabase.inMemory("memory", "history");
        database.close();
        assertDoesNotThrow(() -> database.close());
        assertDoesNotThrow(() -> database.checkpoint());
    }

    @Test
    void inTransaction_shouldRollBackOnFailure() {
        database = SqliteDatabase.inMemory("memory", "history");

        assertThrows(DatabaseException.class, () -> database.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-history-entry"))) {
                ps.setString(1, "a.png");
                ps.setLong(2, 1L);
                ps.executeUpdate();
            }
            throw new SQLException("boom");
        }));

        int count = database.withConnection(conn -> {
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM history_entries")) {
                return rs.next() ? rs.getInt(1) : -1;
            }
        });
        assertEquals(0, count);
    }

    private void insertEntry(String reference) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-history-entry"))) {
                ps.setString(1, reference);
                ps.setLong(2, System.currentTimeMillis());
                return ps.executeUpdate();
            }
        });
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (java.io.IOException e) {
            throw new AssertionError(e);
        }
    }
}
