package io.songsite.chords.songbook;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A song file found on disk.
 *
 * @param file         where to read it from
 * @param relativePath its location below the input it was found under; for a file named
 *                     explicitly this is just the file name
 */
public record SongFile(Path file, Path relativePath) {

    public SongFile {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(relativePath, "relativePath");
        if (relativePath.isAbsolute()) {
            throw new IllegalArgumentException("relativePath must be relative: " + relativePath);
        }
    }

    public static SongFile named(Path file) {
        return new SongFile(file, file.getFileName());
    }
}
