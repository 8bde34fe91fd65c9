package de.bsommerfeld.canvas.db;

import de.bsommerfeld.canvas.db.MediaLibrary.NewMediaFile;
import de.bsommerfeld.canvas.db.model.Folder;
import de.bsommerfeld.canvas.db.model.MediaFile;
import de.bsommerfeld.canvas.db.model.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Imports media from disk into the {@link MediaLibrary} and keeps imported
 * folders in sync with their directories.
 *
 * <p>
 * Calls block on file-system and database I/O. The desktop layer runs them on
 * a background worker.
 */
public class ImportService {

    private static final Logger LOG = LoggerFactory.getLogger(ImportService.class);

    private static final Comparator<Path> BY_FILE_NAME = Comparator.comparing(
            (Path p) -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE);

    private final MediaLibrary library;

    public ImportService(MediaLibrary library) {
        this.library = library;
    }

    /**
     * Imports one file as a root entry.
     *
     * @return the stored file (the existing record when the path was already
     *         imported), or empty if the file is missing or unsupported
     */
    public Optional<MediaFile> importSingleFile(Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.warn("Cannot import {}: not a file", file);
            return Optional.empty();
        }
        Optional<MediaType> type = MediaType.of(file);
        if (type.isEmpty()) {
            LOG.warn("Cannot import {}: unsupported format", file);
            return Optional.empty();
        }
        String path = normalize(file);
        Optional<MediaFile> existing = library.findMediaFileByPath(path);
        if (existing.isPresent()) {
            return existing;
        }
        MediaFile added = library.addRootMediaFile(baseName(file), path, type.get());
        LOG.info("Imported file {}", added.path());
        return Optional.of(added);
    }

    /**
     * Imports every supported file below the directory, recursively, ordered
     * by natural file name. Files already stored for the folder are reported
     * as existing and left untouched.
     *
     * @throws IllegalArgumentException if the path is not a directory
     * @throws UncheckedIOException     if the directory cannot be scanned
     */
    public FolderImportResult importFolder(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        List<Path> media = scan(directory);
        if (media.isEmpty()) {
            LOG.info("No supported media found in {}", directory);
            return FolderImportResult.nothingFound();
        }

        String folderPath = normalize(directory);
        Folder folder = library.findFolderByPath(folderPath)
                .orElseGet(() -> library.addFolder(folderName(directory), folderPath));

        Set<String> stored = library.getMediaFilesInFolder(folder.id()).stream()
                .map(MediaFile::path)
                .collect(Collectors.toSet());

        List<String> existing = new ArrayList<>();
        List<NewMediaFile> fresh = new ArrayList<>();
        for (Path file : media) {
            String path = normalize(file);
            if (stored.contains(path)) {
                existing.add(path);
            } else {
                fresh.add(new NewMediaFile(baseName(file), path, MediaType.of(file).orElseThrow()));
            }
        }

        List<MediaFile> added = library.addMediaFiles(folder.id(), fresh);
        LOG.info("Imported folder {}: {} new, {} existing", folder.path(), added.size(), existing.size());
        return new FolderImportResult(folder, added, existing);
    }

    /**
     * Reconciles every stored folder with disk: new files are added, vanished
     * files removed, and changed folders renumbered in natural order. Folders
     * whose directory is gone are left as they are. A failing folder is logged
     * and does not stop the others.
     */
    public SyncResult syncAllFolders() {
        SyncResult total = SyncResult.NONE;
        for (Folder folder : library.getAllFolders()) {
            try {
                total = total.plus(syncFolder(folder));
            } catch (RuntimeException e) {
                LOG.warn("Failed to sync folder {}", folder.path(), e);
            }
        }
        LOG.info("Synced all folders: {} added, {} removed", total.added(), total.removed());
        return total;
    }

    /** Reconciles a single folder; see {@link #syncAllFolders()}. */
    public SyncResult syncFolder(Folder folder) {
        Path directory = Path.of(folder.path());
        if (!Files.isDirectory(directory)) {
            LOG.warn("Folder {} no longer exists on disk", folder.path());
            return SyncResult.NONE;
        }

        List<Path> onDisk = scan(directory);
        Set<String> diskPaths = new HashSet<>();
        for (Path file : onDisk) {
            diskPaths.add(normalize(file));
        }

        List<MediaFile> stored = library.getMediaFilesInFolder(folder.id());
        Set<String> storedPaths = new HashSet<>();
        for (MediaFile file : stored) {
            storedPaths.add(file.path());
        }

        List<NewMediaFile> fresh = new ArrayList<>();
        for (Path file : onDisk) {
            String path = normalize(file);
            if (!storedPaths.contains(path)) {
                fresh.add(new NewMediaFile(baseName(file), path, MediaType.of(file).orElseThrow()));
            }
        }

        int removed = 0;
        for (MediaFile file : stored) {
            if (!diskPaths.contains(file.path())) {
                library.deleteMediaFile(file.id());
                removed++;
            }
        }
        int added = library.addMediaFiles(folder.id(), fresh).size();

        if (added > 0 || removed > 0) {
            renumber(folder);
        }
        return new SyncResult(added, removed);
    }

    private void renumber(Folder folder) {
        List<MediaFile> files = new ArrayList<>(library.getMediaFilesInFolder(folder.id()));
        files.sort(Comparator.comparing(
                (MediaFile f) -> Path.of(f.path()).getFileName().toString(), NaturalOrderComparator.INSTANCE));
        library.reorder(files);
    }

    private static List<Path> scan(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(MediaType::isSupported)
                    .sorted(BY_FILE_NAME)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + directory, e);
        }
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    private static String folderName(Path directory) {
        Path name = directory.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : directory.toString();
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
