package io.songsite.chords.model;

import io.songsite.chords.render.Markup;
import io.songsite.chords.text.Chord;
import io.songsite.chords.text.ChordLineDecomposer;
import io.songsite.chords.text.DecomposedLine;
import io.songsite.chords.text.TextReflow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A lyric line annotated with bracketed chords.
 *
 * @param text     the line as written, chord markup included
 * @param bareText the lyrics with every chord removed
 * @param chords   chords by ascending column of {@code bareText}, never touching each other
 */
public record ChordLine(int lineno, String text, String bareText, List<Chord> chords) implements SongLine {

    public ChordLine {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(bareText, "bareText");
        chords = List.copyOf(Objects.requireNonNull(chords, "chords"));
        for (int i = 1; i < chords.size(); i++) {
            if (chords.get(i).offset() <= chords.get(i - 1).end()) {
                throw new IllegalArgumentException("Chord '" + chords.get(i).text() + "' at line " + lineno
                        + " overlaps the chord before it");
            }
        }
    }

    public static ChordLine of(int lineno, String text) {
        DecomposedLine decomposed = ChordLineDecomposer.decompose(text);
        return new ChordLine(lineno, text, decomposed.bareText(), decomposed.chords());
    }

    @Override
    public LineKind kind() {
        return LineKind.CHORD;
    }

    @Override
    public String source() {
        return text;
    }

    @Override
    public String renderInline() {
        return Markup.span(Markup.CHORDS, ChordLineDecomposer.chordRow(chords)) + "\n"
                + Markup.span(Markup.LYRICS, bareText) + "\n";
    }

    /**
     * Wraps on the visible lyrics and re-decomposes every fragment, so each wrapped lyric line is
     * preceded by its own highlighted chord row.
     */
    @Override
    public List<String> renderPaged(int width) {
        List<String> fragments = TextReflow.wrapChordLine(text, width);
        List<String> rendered = new ArrayList<>(fragments.size() * 2);
        for (String fragment : fragments) {
            DecomposedLine decomposed = ChordLineDecomposer.decompose(fragment);
            rendered.add(Markup.highlightChords(ChordLineDecomposer.chordRow(decomposed.chords(), Markup::capitalize)));
            rendered.add(decomposed.bareText());
        }
        return rendered;
    }

    @Override
    public String describe() {
        return "    " + ChordLineDecomposer.chordRow(chords) + "\n" + String.format("%03d %s", lineno, bareText);
    }
}
