package io.songsite.chords.songbook;

import io.songsite.chords.model.Document;

/**
 * Turns a parsed song into the text of one output file.
 */
public interface SongRenderer {

    String render(SongSource source, Document document, int width);

    /**
     * Extension of the files this renderer produces, without the dot.
     */
    String fileExtension();
}
