package de.bsommerfeld.canvas.db;

import de.bsommerfeld.canvas.db.model.Folder;
import de.bsommerfeld.canvas.db.model.MediaFile;
import de.bsommerfeld.canvas.db.model.MediaType;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for folders and media files.
 */
public interface MediaLibrary {

    Optional<Folder> findFolderByPath(String path);

    /** Inserts a folder at the end of the root folder list. */
    Folder addFolder(String name, String path);

    List<Folder> getAllFolders();

    /** Removes the folder together with all of its media files. */
    void deleteFolder(long folderId);

    Optional<MediaFile> findMediaFileByPath(String path);

    /** Inserts a file that does not belong to any folder, appended at the end. */
    MediaFile addRootMediaFile(String name, String path, MediaType type);

    /**
     * Inserts files into a folder in one transaction. Entries are
     * {@code (name, path, type)} triples in the order they should get
     * consecutive order indexes, starting after the folder's current last one.
     */
    List<MediaFile> addMediaFiles(long folderId, List<NewMediaFile> files);

    List<MediaFile> getMediaFilesInFolder(long folderId);

    List<MediaFile> getRootMediaFiles();

    /** Rewrites order indexes so the given files are numbered 1..n in list order. */
    void reorder(List<MediaFile> files);

    void deleteMediaFile(long mediaFileId);

    /** Name, path and type of a file about to be inserted. */
    record NewMediaFile(String name, String path, MediaType type) {
    }
}
