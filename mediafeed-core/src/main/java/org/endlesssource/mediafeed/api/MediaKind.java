package org.endlesssource.mediafeed.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Coarse media classification derived from the file extension.
 */
public enum MediaKind {
    VIDEO,
    IMAGE,
    AUDIO;

    /**
     * Classify a file by its extension (case-insensitive)
     * @param path File to classify
     * @return The media kind, or empty if the extension is not recognised
     */
    public static Optional<MediaKind> fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(name.substring(dot + 1));
    }

    public static Optional<MediaKind> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case "jpg", "jpeg", "png", "gif", "bmp", "webp", "svg", "tiff" -> Optional.of(IMAGE);
            case "mp4", "mkv", "webm", "avi", "mov", "wmv", "flv", "mpeg" -> Optional.of(VIDEO);
            case "mp3", "wav", "ogg", "m4a", "flac", "aac" -> Optional.of(AUDIO);
            default -> Optional.empty();
        };
    }
}
