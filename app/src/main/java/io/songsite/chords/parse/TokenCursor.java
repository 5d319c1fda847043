package io.songsite.chords.parse;

import io.songsite.chords.model.SongLine;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Forward-only read position over an immutable token list.
 */
final class TokenCursor {

    private final List<SongLine> tokens;
    private int position;

    TokenCursor(List<SongLine> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    boolean hasNext() {
        return position < tokens.size();
    }

    SongLine peek() {
        if (!hasNext()) {
            throw new NoSuchElementException("No token left after line " + tokens.size());
        }
        return tokens.get(position);
    }

    SongLine next() {
        SongLine token = peek();
        position++;
        return token;
    }

    int position() {
        return position;
    }
}
