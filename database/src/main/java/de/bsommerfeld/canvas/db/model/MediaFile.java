package de.bsommerfeld.canvas.db.model;

/**
 * A single imported media file.
 *
 * @param id         database id
 * @param name       file name without extension
 * @param path       absolute file path, unique
 * @param folderId   owning folder, or {@code null} for files imported on
 *                   their own
 * @param type       media kind
 * @param orderIndex position within the folder, starting at 1
 */
public record MediaFile(long id, String name, String path, Long folderId, MediaType type, int orderIndex) {

    public boolean isRootFile() {
        return folderId == null;
    }
}
