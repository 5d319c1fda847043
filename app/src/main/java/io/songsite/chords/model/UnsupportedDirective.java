package io.songsite.chords.model;

import io.songsite.chords.render.PagedBlock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A directive that is recognized but has no rendering, such as {@code {title: ...}}. Its value is
 * kept so callers can still read song metadata.
 */
public record UnsupportedDirective(int lineno, String name, String value, String raw) implements Directive, PassThrough {

    public UnsupportedDirective {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.UNSUPPORTED_DIRECTIVE;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String renderInline() {
        return "";
    }

    @Override
    public List<String> renderPaged(int width) {
        return List.of();
    }

    @Override
    public Optional<PagedBlock> toPagedBlock(int width) {
        return Optional.empty();
    }

    @Override
    public String describe() {
        return String.format("%03d {%s: %s} [UNSUPPORTED]", lineno, name, value);
    }
}
