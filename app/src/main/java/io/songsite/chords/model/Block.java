package io.songsite.chords.model;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.PagedBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A group of lines rendered as one paragraph. Blocks only ever hold lines, never other blocks,
 * and are closed once built.
 */
public sealed interface Block extends SongElement permits Verse, Chorus, Tablature {

    List<SongLine> lines();

    BlockStyle style();

    /**
     * Whether an end directive closed the block, as opposed to the end of the input.
     */
    boolean explicitlyClosed();

    @Override
    default List<String> renderPaged(int width) {
        List<String> fragments = new ArrayList<>();
        for (SongLine line : lines()) {
            fragments.addAll(line.renderPaged(width));
        }
        return fragments;
    }

    @Override
    default Optional<PagedBlock> toPagedBlock(int width) {
        return Optional.of(new PagedBlock(style(), renderPaged(width)));
    }
}
