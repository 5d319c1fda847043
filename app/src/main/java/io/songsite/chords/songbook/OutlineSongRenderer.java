package io.songsite.chords.songbook;

import io.songsite.chords.model.Document;

/**
 * Line-numbered dump of the parsed structure, handy for checking how a song was understood.
 */
public class OutlineSongRenderer implements SongRenderer {

    @Override
    public String render(SongSource source, Document document, int width) {
        String header = String.format("File %s contains %d blocks", source.path(), document.size());
        if (document.size() == 0) {
            return header;
        }
        return header + "\n" + document.describe();
    }

    @Override
    public String fileExtension() {
        return "outline";
    }
}
