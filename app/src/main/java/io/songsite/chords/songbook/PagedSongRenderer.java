package io.songsite.chords.songbook;

import io.songsite.chords.model.Document;
import io.songsite.chords.render.PagedBlock;
import io.songsite.chords.render.StyleRegistry;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes the print layout as plain text: every paragraph is introduced by its resolved style name
 * in brackets and separated from the next one by an empty line.
 */
public class PagedSongRenderer implements SongRenderer {

    private final StyleRegistry<String> styleRegistry;

    public PagedSongRenderer(StyleRegistry<String> styleRegistry) {
        this.styleRegistry = Objects.requireNonNull(styleRegistry, "styleRegistry");
    }

    @Override
    public String render(SongSource source, Document document, int width) {
        List<PagedBlock> blocks = document.renderPaged(width);
        return blocks.stream()
                .map(block -> "[" + block.resolveStyle(styleRegistry) + "]\n" + block.text())
                .collect(Collectors.joining("\n\n"));
    }

    @Override
    public String fileExtension() {
        return "txt";
    }
}
