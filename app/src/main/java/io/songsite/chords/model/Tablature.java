package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.Markup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Instrument tablature delimited by {@code {start_of_tab}} and {@code {end_of_tab}}, kept as
 * verbatim text.
 */
public record Tablature(StartTablature start, List<SongLine> lines, Optional<EndTablature> end) implements Block {

    public Tablature {
        Objects.requireNonNull(start, "start");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        end = end == null ? Optional.empty() : end;
        for (SongLine line : lines) {
            if (line.kind().isDirective() && line.kind() != LineKind.INLINE_COMMENT) {
                throw new IllegalArgumentException("Line " + line.lineno() + ": Cannot have command inside Tablature.");
            }
        }
    }

    @Override
    public int lineno() {
        return start.lineno();
    }

    @Override
    public BlockStyle style() {
        return BlockStyle.TABLATURE;
    }

    @Override
    public boolean explicitlyClosed() {
        return end.isPresent();
    }

    @Override
    public String renderInline() {
        String body = lines.stream()
                .map(SongLine::renderInline)
                .collect(Collectors.joining("\n"));
        return "\n" + Markup.span(Markup.TABLATURE, body) + "\n";
    }

    @Override
    public String describe() {
        List<String> parts = new ArrayList<>();
        parts.add(start.describe());
        lines.forEach(line -> parts.add(line.describe()));
        end.ifPresent(marker -> parts.add(marker.describe()));
        return String.join("\n", parts);
    }
}
