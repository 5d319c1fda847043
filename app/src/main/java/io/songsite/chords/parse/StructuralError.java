package io.songsite.chords.parse;

import java.util.Objects;

/**
 * Why a song could not be assembled into blocks.
 *
 * @param lineno  line that broke the block structure
 * @param content that line as written
 * @param message human readable description
 */
public record StructuralError(int lineno, String content, String message) {

    public StructuralError {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return message;
    }
}
