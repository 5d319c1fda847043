package io.songsite.chords.model;

/**
 * Classification of a single input line after tokenizing.
 */
public enum LineKind {
    BLANK,
    HASH_COMMENT,
    PLAIN,
    CHORD,
    START_CHORUS,
    END_CHORUS,
    START_TABLATURE,
    END_TABLATURE,
    INLINE_COMMENT,
    UNSUPPORTED_DIRECTIVE;

    public boolean isLyric() {
        return this == PLAIN || this == CHORD;
    }

    public boolean isDirective() {
        return switch (this) {
            case START_CHORUS, END_CHORUS, START_TABLATURE, END_TABLATURE, INLINE_COMMENT, UNSUPPORTED_DIRECTIVE -> true;
            case BLANK, HASH_COMMENT, PLAIN, CHORD -> false;
        };
    }
}
