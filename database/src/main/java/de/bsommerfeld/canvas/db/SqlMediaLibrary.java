package de.bsommerfeld.canvas.db;

import de.bsommerfeld.canvas.db.model.Folder;
import de.bsommerfeld.canvas.db.model.MediaFile;
import de.bsommerfeld.canvas.db.model.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link MediaLibrary} over the primary {@link SqliteDatabase}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} and is loaded through {@link SqlLoader}.
 * Multi-row inserts and reorders run in a single transaction.
 */
public class SqlMediaLibrary implements MediaLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(SqlMediaLibrary.class);

    private final SqliteDatabase database;

    public SqlMediaLibrary(SqliteDatabase database) {
        this.database = database;
    }

    // =====================================================================
    // Folders
    // =====================================================================

    @Override
    public Optional<Folder> findFolderByPath(String path) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-folder-by-path"))) {
                ps.setString(1, path);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapFolder(rs)) : Optional.<Folder>empty();
                }
            }
        });
    }

    @Override
    public Folder addFolder(String name, String path) {
        return database.inTransaction(conn -> {
            int order = nextIndex(conn, SqlLoader.load("select-next-folder-order"));
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-folder"),
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, name);
                ps.setString(2, path);
                ps.setInt(3, order);
                ps.setLong(4, Instant.now().getEpochSecond());
                ps.executeUpdate();
                long id = generatedId(ps);
                LOG.debug("Added folder {} ({}) with id {}", name, path, id);
                return new Folder(id, name, path, order);
            }
        });
    }

    @Override
    public List<Folder> getAllFolders() {
        return database.withConnection(conn -> {
            List<Folder> folders = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-folders"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    folders.add(mapFolder(rs));
                }
            }
            return folders;
        });
    }

    @Override
    public void deleteFolder(long folderId) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-folder"))) {
                ps.setLong(1, folderId);
                return ps.executeUpdate();
            }
        });
    }

    // =====================================================================
    // Media files
    // =====================================================================

    @Override
    public Optional<MediaFile> findMediaFileByPath(String path) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-media-file-by-path"))) {
                ps.setString(1, path);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapMediaFile(rs)) : Optional.<MediaFile>empty();
                }
            }
        });
    }

    @Override
    public MediaFile addRootMediaFile(String name, String path, MediaType type) {
        return database.inTransaction(conn -> {
            int order = nextIndex(conn, SqlLoader.load("select-next-root-order"));
            return insertMediaFile(conn, null, new NewMediaFile(name, path, type), order);
        });
    }

    @Override
    public List<MediaFile> addMediaFiles(long folderId, List<NewMediaFile> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        return database.inTransaction(conn -> {
            int order = lastOrderIndex(conn, folderId) + 1;
            List<MediaFile> added = new ArrayList<>(files.size());
            for (NewMediaFile file : files) {
                added.add(insertMediaFile(conn, folderId, file, order++));
            }
            LOG.debug("Added {} media files to folder {}", added.size(), folderId);
            return added;
        });
    }

    @Override
    public List<MediaFile> getMediaFilesInFolder(long folderId) {
        return database.withConnection(conn -> queryMediaFiles(conn, folderId));
    }

    @Override
    public List<MediaFile> getRootMediaFiles() {
        return database.withConnection(conn -> {
            List<MediaFile> files = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-root-media-files"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    files.add(mapMediaFile(rs));
                }
            }
            return files;
        });
    }

    @Override
    public void reorder(List<MediaFile> files) {
        if (files.isEmpty()) {
            return;
        }
        database.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-media-file-order"))) {
                int index = 1;
                for (MediaFile file : files) {
                    ps.setInt(1, index++);
                    ps.setLong(2, file.id());
                    ps.addBatch();
                }
                return ps.executeBatch();
            }
        });
    }

    @Override
    public void deleteMediaFile(long mediaFileId) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-media-file"))) {
                ps.setLong(1, mediaFileId);
                return ps.executeUpdate();
            }
        });
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private MediaFile insertMediaFile(Connection conn, Long folderId, NewMediaFile file, int order)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-media-file"),
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, file.name());
            ps.setString(2, file.path());
            if (folderId == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setLong(3, folderId);
            }
            ps.setString(4, file.type().name());
            ps.setInt(5, order);
            ps.setLong(6, Instant.now().getEpochSecond());
            ps.executeUpdate();
            return new MediaFile(generatedId(ps), file.name(), file.path(), folderId, file.type(), order);
        }
    }

    private List<MediaFile> queryMediaFiles(Connection conn, long folderId) throws SQLException {
        List<MediaFile> files = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-media-files-in-folder"))) {
            ps.setLong(1, folderId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    files.add(mapMediaFile(rs));
                }
            }
        }
        return files;
    }

    private int lastOrderIndex(Connection conn, long folderId) throws SQLException {
        int last = 0;
        for (MediaFile file : queryMediaFiles(conn, folderId)) {
            last = Math.max(last, file.orderIndex());
        }
        return last;
    }

    private static int nextIndex(Connection conn, String sql) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 1;
        }
    }

    private static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (keys.next()) {
                return keys.getLong(1);
            }
        }
        throw new SQLException("No generated key returned");
    }

    private static Folder mapFolder(ResultSet rs) throws SQLException {
        return new Folder(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("path"),
                rs.getInt("order_index"));
    }

    private static MediaFile mapMediaFile(ResultSet rs) throws SQLException {
        long folderId = rs.getLong("folder_id");
        Long folder = rs.wasNull() ? null : folderId;
        return new MediaFile(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("path"),
                folder,
                MediaType.fromColumn(rs.getString("file_type")),
                rs.getInt("order_index"));
    }
}
