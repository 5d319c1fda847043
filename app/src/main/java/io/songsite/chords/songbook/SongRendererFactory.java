package io.songsite.chords.songbook;

import io.songsite.chords.config.OutputFormat;
import io.songsite.chords.render.BlockStyle;
import java.util.Objects;

/**
 * Provides renderer instances based on the requested output format.
 */
public class SongRendererFactory {

    private final SongRenderer htmlRenderer;
    private final SongRenderer pagedRenderer;
    private final SongRenderer outlineRenderer;

    public SongRendererFactory(SongRenderer htmlRenderer,
                               SongRenderer pagedRenderer,
                               SongRenderer outlineRenderer) {
        this.htmlRenderer = Objects.requireNonNull(htmlRenderer, "htmlRenderer");
        this.pagedRenderer = Objects.requireNonNull(pagedRenderer, "pagedRenderer");
        this.outlineRenderer = Objects.requireNonNull(outlineRenderer, "outlineRenderer");
    }

    public static SongRendererFactory withDefaults() {
        return new SongRendererFactory(new HtmlSongRenderer(),
                new PagedSongRenderer(BlockStyle::styleName),
                new OutlineSongRenderer());
    }

    public SongRenderer select(OutputFormat format) {
        return switch (format) {
            case HTML -> htmlRenderer;
            case PAGED -> pagedRenderer;
            case OUTLINE -> outlineRenderer;
        };
    }
}
