package io.songsite.chords.text;

import java.util.Objects;

/**
 * A chord placed above the lyric text, at an absolute column of the bare line.
 */
public record Chord(int offset, String text) {

    public Chord {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be greater than or equal to zero");
        }
        Objects.requireNonNull(text, "text");
    }

    /**
     * First column after the chord name.
     */
    public int end() {
        return offset + text.length();
    }
}
