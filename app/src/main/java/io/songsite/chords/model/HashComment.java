package io.songsite.chords.model;

import io.songsite.chords.render.PagedBlock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code #} annotation kept in the tree but never shown to readers. Unknown directives end up
 * here as well, marked {@code [IGNORED]}.
 */
public record HashComment(int lineno, String text) implements SongLine, PassThrough {

    public HashComment {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public LineKind kind() {
        return LineKind.HASH_COMMENT;
    }

    @Override
    public String source() {
        return text;
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
        return String.format("%03d %s", lineno, text);
    }
}
