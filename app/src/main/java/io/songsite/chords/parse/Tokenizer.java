package io.songsite.chords.parse;

import io.songsite.chords.model.Blank;
import io.songsite.chords.model.ChordLine;
import io.songsite.chords.model.HashComment;
import io.songsite.chords.model.PlainLine;
import io.songsite.chords.model.SongLine;
import io.songsite.chords.text.ChordLineDecomposer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies every physical line of a song into exactly one {@link SongLine}.
 */
public class Tokenizer {

    private final DirectiveRecognizer directiveRecognizer;

    public Tokenizer() {
        this(new DirectiveRecognizer());
    }

    public Tokenizer(DirectiveRecognizer directiveRecognizer) {
        this.directiveRecognizer = Objects.requireNonNull(directiveRecognizer, "directiveRecognizer");
    }

    /**
     * Splits on {@code \n} and numbers lines from 1. A trailing newline yields a final blank line.
     */
    public List<SongLine> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        String[] lines = text.split("\n", -1);
        List<SongLine> tokens = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            tokens.add(tokenizeLine(lines[i], i + 1));
        }
        return tokens;
    }

    public SongLine tokenizeLine(String line, int lineno) {
        String stripped = strip(line);
        if (stripped.isEmpty()) {
            return new Blank(lineno);
        }
        if (stripped.charAt(0) == '#') {
            return new HashComment(lineno, stripped);
        }
        if (stripped.charAt(0) == '{') {
            return directiveRecognizer.recognize(stripped, lineno);
        }
        String lyric = line.substring(0, trailingEnd(line));
        if (ChordLineDecomposer.containsChord(lyric)) {
            return ChordLine.of(lineno, lyric);
        }
        return new PlainLine(lineno, lyric);
    }

    /**
     * Like {@link String#strip()}, but no-break and other Unicode space separators count as
     * whitespace too.
     */
    private static String strip(String line) {
        int end = trailingEnd(line);
        int start = 0;
        while (start < end && isSpace(line.charAt(start))) {
            start++;
        }
        return line.substring(start, end);
    }

    private static int trailingEnd(String line) {
        int end = line.length();
        while (end > 0 && isSpace(line.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }
}
