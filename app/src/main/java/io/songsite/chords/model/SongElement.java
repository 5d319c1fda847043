package io.songsite.chords.model;

import io.songsite.chords.render.PagedBlock;
import io.songsite.chords.render.Renderable;
import java.util.Optional;

/**
 * Top-level entry of a {@link Document}: either a block or a line that sits between blocks.
 */
public sealed interface SongElement extends Renderable permits PassThrough, Block {

    /**
     * Line number of the first input line covered by this element.
     */
    int lineno();

    String describe();

    /**
     * The paragraph this element contributes to print layout, if any.
     */
    Optional<PagedBlock> toPagedBlock(int width);
}
