package de.bsommerfeld.canvas.db;

import de.bsommerfeld.canvas.db.model.HistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Most-recent-first log of projected items, backed by the secondary
 * database.
 *
 * <p>
 * New entries stay in memory until {@link #persist()} writes them. At most
 * {@code maxEntries} are kept, both in memory and in the table.
 */
public class HistoryLog {

    private static final Logger LOG = LoggerFactory.getLogger(HistoryLog.class);

    private final SqliteDatabase database;
    private final int maxEntries;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();
    private final List<HistoryEntry> pending = new ArrayList<>();

    public HistoryLog(SqliteDatabase database, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.database = database;
        this.maxEntries = maxEntries;
    }

    /** Replaces the in-memory log with the stored entries. */
    public synchronized void load() {
        List<HistoryEntry> stored = database.withConnection(conn -> {
            List<HistoryEntry> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-history"))) {
                ps.setInt(1, maxEntries);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new HistoryEntry(rs.getString("reference"),
                                Instant.ofEpochMilli(rs.getLong("recorded_at"))));
                    }
                }
            }
            return result;
        });
        entries.clear();
        pending.clear();
        entries.addAll(stored);
        LOG.info("Loaded {} history entries", stored.size());
    }

    public synchronized void record(String reference) {
        record(new HistoryEntry(reference, Instant.now()));
    }

    public synchronized void record(HistoryEntry entry) {
        entries.addFirst(entry);
        pending.add(entry);
        while (entries.size() > maxEntries) {
            HistoryEntry dropped = entries.removeLast();
            pending.remove(dropped);
        }
    }

    /** Snapshot, newest first. */
    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Writes pending entries and trims the table to {@code maxEntries}.
     *
     * @throws DatabaseException if the write fails; pending entries are kept
     */
    public synchronized void persist() {
        if (pending.isEmpty()) {
            return;
        }
        int written = database.inTransaction(conn -> {
            try (PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert-history-entry"))) {
                for (HistoryEntry entry : pending) {
                    insert.setString(1, entry.reference());
                    insert.setLong(2, entry.timestamp().toEpochMilli());
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            try (PreparedStatement trim = conn.prepareStatement(SqlLoader.load("trim-history"))) {
                trim.setInt(1, maxEntries);
                trim.executeUpdate();
            }
            return pending.size();
        });
        pending.clear();
        LOG.info("Persisted {} history entries", written);
    }

    /**
     * Empties the log in memory and in the table.
     *
     * @throws DatabaseException if the table cannot be cleared
     */
    public synchronized void clear() {
        entries.clear();
        pending.clear();
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-all-history"))) {
                return ps.executeUpdate();
            }
        });
        LOG.info("History cleared");
    }
}
