package io.songsite.chords.songbook;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of rendering a single song.
 *
 * @param relativePath location of the source below its input root
 */
public record RenderedSong(String sourcePath, Path relativePath, String fileExtension, String content) {

    public RenderedSong {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(fileExtension, "fileExtension");
        Objects.requireNonNull(content, "content");
    }

    /**
     * The relative source path with its extension replaced by the renderer's.
     */
    public Path outputPath() {
        String name = relativePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return relativePath.resolveSibling(base + "." + fileExtension);
    }
}
