package de.bsommerfeld.canvas.db;

import de.bsommerfeld.canvas.db.model.Folder;
import de.bsommerfeld.canvas.db.model.MediaFile;

import java.util.List;

/**
 * Outcome of {@link ImportService#importFolder}.
 *
 * @param folder        the stored folder, or {@code null} when the directory
 *                      held no supported media and nothing was stored
 * @param newFiles      files inserted by this import, in order
 * @param existingFiles paths that were already part of the folder
 */
public record FolderImportResult(Folder folder, List<MediaFile> newFiles, List<String> existingFiles) {

    public FolderImportResult {
        newFiles = List.copyOf(newFiles);
        existingFiles = List.copyOf(existingFiles);
    }

    static FolderImportResult nothingFound() {
        return new FolderImportResult(null, List.of(), List.of());
    }

    public boolean hasFolder() {
        return folder != null;
    }

    public boolean isAllExisting() {
        return newFiles.isEmpty() && !existingFiles.isEmpty();
    }
}
