package io.songsite.chords.model;

import io.songsite.chords.render.Markup;
import io.songsite.chords.text.TextReflow;
import java.util.List;
import java.util.Objects;

/**
 * A lyric line without chords. Leading indentation is kept, trailing whitespace is not.
 */
public record PlainLine(int lineno, String text) implements SongLine {

    public PlainLine {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public LineKind kind() {
        return LineKind.PLAIN;
    }

    @Override
    public String source() {
        return text;
    }

    @Override
    public String renderInline() {
        return Markup.span(Markup.LINE, text);
    }

    @Override
    public List<String> renderPaged(int width) {
        return TextReflow.wrap(text, width);
    }

    @Override
    public String describe() {
        return String.format("%03d %s", lineno, text);
    }
}
