package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A run of consecutive lyric lines, delimited by blank lines, comments or directives.
 */
public record Verse(List<SongLine> lines) implements Block {

    public Verse {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("A verse needs at least one line");
        }
        for (SongLine line : lines) {
            if (!line.kind().isLyric()) {
                throw new IllegalArgumentException("Line " + line.lineno() + " is not a lyric line");
            }
        }
    }

    @Override
    public int lineno() {
        return lines.get(0).lineno();
    }

    @Override
    public BlockStyle style() {
        return BlockStyle.VERSE;
    }

    @Override
    public boolean explicitlyClosed() {
        return false;
    }

    @Override
    public String renderInline() {
        return lines.stream()
                .map(SongLine::renderInline)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String describe() {
        List<String> parts = new ArrayList<>();
        parts.add("--- Verse:");
        lines.forEach(line -> parts.add(line.describe()));
        parts.add("--- End verse");
        return String.join("\n", parts);
    }
}
