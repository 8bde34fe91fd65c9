package de.bsommerfeld.canvas.db.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of media file, classified by file extension.
 */
public enum MediaType {

    IMAGE(List.of(".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tif")),
    VIDEO(List.of(".mp4", ".avi", ".mkv", ".mov", ".wmv", ".flv", ".f4v", ".rm", ".rmvb")),
    AUDIO(List.of(".mp3", ".wav", ".flac", ".ogg", ".m4a", ".aac"));

    private final List<String> extensions;

    MediaType(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Classifies a path by its extension, case-insensitively.
     *
     * @return the media type, or empty for unsupported files
     */
    public static Optional<MediaType> of(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String extension = extensionOf(fileName.toString());
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        for (MediaType type : values()) {
            if (type.extensions.contains(extension)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static boolean isSupported(Path path) {
        return of(path).isPresent();
    }

    /** Lower-cased extension including the dot, or an empty string. */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Parses the stored column value; unknown values fall back to IMAGE. */
    public static MediaType fromColumn(String value) {
        if (value == null) {
            return IMAGE;
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return IMAGE;
        }
    }
}
