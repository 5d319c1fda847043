package io.songsite.chords.writer;

import io.songsite.chords.songbook.RenderedSong;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes rendered songs into an output directory, keeping their layout below the input root, or
 * onto a stream when no directory is configured.
 */
public class SongWriter {

    public Path write(Path outputDirectory, RenderedSong song) {
        if (outputDirectory == null || song == null) {
            throw new IllegalArgumentException("outputDirectory and song must be provided");
        }
        Path target = outputDirectory.resolve(song.outputPath());
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, withTrailingNewline(song.content()), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered song: " + target, ex);
        }
    }

    public void print(PrintWriter out, RenderedSong song) {
        out.print(withTrailingNewline(song.content()));
    }

    private static String withTrailingNewline(String content) {
        return content.isEmpty() || content.endsWith("\n") ? content : content + "\n";
    }
}
