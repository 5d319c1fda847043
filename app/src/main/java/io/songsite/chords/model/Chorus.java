package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.Markup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A chorus delimited by {@code {start_of_chorus}} and {@code {end_of_chorus}}. Besides lyrics it
 * may hold blank lines and comments.
 */
public record Chorus(StartChorus start, List<SongLine> lines, Optional<EndChorus> end) implements Block {

    public Chorus {
        Objects.requireNonNull(start, "start");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        end = end == null ? Optional.empty() : end;
        for (SongLine line : lines) {
            if (line.kind().isDirective() && line.kind() != LineKind.INLINE_COMMENT) {
                throw new IllegalArgumentException("Line " + line.lineno() + ": Cannot have command inside Chorus.");
            }
        }
    }

    @Override
    public int lineno() {
        return start.lineno();
    }

    @Override
    public BlockStyle style() {
        return BlockStyle.CHORUS;
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
        return "\n" + Markup.span(Markup.CHORUS, body) + "\n";
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
