package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.Markup;
import io.songsite.chords.render.PagedBlock;
import io.songsite.chords.text.TextReflow;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code {comment: ...}} directive, shown to readers as an aside.
 */
public record InlineComment(int lineno, String text, String raw) implements Directive, PassThrough {

    public InlineComment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.INLINE_COMMENT;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String renderInline() {
        return Markup.span(Markup.COMMENT, text) + "\n";
    }

    @Override
    public List<String> renderPaged(int width) {
        return TextReflow.wrap(text, width).stream()
                .map(Markup::emphasizeComment)
                .toList();
    }

    /**
     * Outside of a block the comment forms its own paragraph; the comment style carries the
     * emphasis there, so the fragments stay plain.
     */
    @Override
    public Optional<PagedBlock> toPagedBlock(int width) {
        return Optional.of(new PagedBlock(BlockStyle.COMMENT, TextReflow.wrap(text, width)));
    }

    @Override
    public String describe() {
        return String.format("%03d {comment: %s}", lineno, text);
    }
}
