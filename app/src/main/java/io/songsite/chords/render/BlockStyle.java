package io.songsite.chords.render;

import java.util.Locale;

/**
 * Paragraph style tokens attached to paged output, resolved by a {@link StyleRegistry}.
 */
public enum BlockStyle {
    VERSE,
    CHORUS,
    TABLATURE,
    COMMENT;

    public String styleName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
