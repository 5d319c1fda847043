package io.songsite.chords.songbook;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The text of one song together with where it came from.
 *
 * @param path         the file as given, used in logs and reports
 * @param relativePath location of the song below its input root, mirrored in the output directory
 * @param text         song text with {@code \n} line endings
 */
public record SongSource(String path, Path relativePath, String text) {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    public SongSource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(text, "text");
    }

    public SongSource(String path, String text) {
        this(path, Path.of(path).getFileName(), text);
    }

    /**
     * Reads a UTF-8 song file, dropping a byte order mark and normalizing line endings to {@code \n}.
     */
    public static SongSource read(SongFile song) throws IOException {
        String text = Files.readString(song.file(), StandardCharsets.UTF_8);
        if (text.startsWith(BYTE_ORDER_MARK)) {
            text = text.substring(1);
        }
        return new SongSource(song.file().toString(), song.relativePath(),
                text.replace("\r\n", "\n").replace('\r', '\n'));
    }
}
