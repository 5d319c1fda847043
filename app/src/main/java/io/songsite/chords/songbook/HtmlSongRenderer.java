package io.songsite.chords.songbook;

import io.songsite.chords.model.Document;

public class HtmlSongRenderer implements SongRenderer {

    @Override
    public String render(SongSource source, Document document, int width) {
        return document.renderInline();
    }

    @Override
    public String fileExtension() {
        return "html";
    }
}
