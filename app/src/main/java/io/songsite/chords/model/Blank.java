package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.Markup;
import io.songsite.chords.render.PagedBlock;
import java.util.List;
import java.util.Optional;

public record Blank(int lineno) implements SongLine, PassThrough {

    @Override
    public LineKind kind() {
        return LineKind.BLANK;
    }

    @Override
    public String source() {
        return "";
    }

    @Override
    public String renderInline() {
        return "";
    }

    @Override
    public List<String> renderPaged(int width) {
        return List.of("");
    }

    @Override
    public Optional<PagedBlock> toPagedBlock(int width) {
        return Optional.of(new PagedBlock(BlockStyle.VERSE, List.of(Markup.PAGED_BREAK)));
    }

    @Override
    public String describe() {
        return String.format("%03d ", lineno);
    }
}
