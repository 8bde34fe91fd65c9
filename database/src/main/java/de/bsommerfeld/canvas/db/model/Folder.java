package de.bsommerfeld.canvas.db.model;

/**
 * An imported directory in the media library.
 *
 * @param id         database id
 * @param name       directory name shown in the library tree
 * @param path       absolute directory path, unique
 * @param orderIndex position among root folders
 */
public record Folder(long id, String name, String path, int orderIndex) {
}
