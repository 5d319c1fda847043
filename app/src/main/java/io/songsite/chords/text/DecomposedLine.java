package io.songsite.chords.text;

import java.util.List;
import java.util.Objects;

/**
 * A chord-bearing line split into its bare lyric text and the chords placed over it.
 */
public record DecomposedLine(String bareText, List<Chord> chords) {

    public DecomposedLine {
        Objects.requireNonNull(bareText, "bareText");
        chords = List.copyOf(Objects.requireNonNull(chords, "chords"));
    }
}
