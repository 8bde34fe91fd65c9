package de.bsommerfeld.canvas.update;

/**
 * One file belonging to a release.
 *
 * @param fileName    name relative to the release directory
 * @param downloadUrl absolute URL
 * @param size        size in bytes, or -1 if {@code files.txt} did not say
 */
public record UpdateFileInfo(String fileName, String downloadUrl, long size) {
}
