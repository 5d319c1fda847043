package io.songsite.chords.render;

import java.util.Locale;

/**
 * Markup vocabulary shared by the renderers. Inline class names are consumed by the site templates
 * and paged font tags by the print layer, so both must stay byte-for-byte stable.
 */
public final class Markup {

    public static final String LINE = "line";
    public static final String CHORDS = "chords";
    public static final String LYRICS = "lyrics";
    public static final String COMMENT = "comment";
    public static final String CHORUS = "chorus";
    public static final String TABLATURE = "tablature";

    public static final String PAGED_BREAK = "<br/>";

    private static final String CHORD_FONT = "#000088";
    private static final String COMMENT_FONT = "#444444";

    private Markup() {
    }

    public static String span(String cssClass, String content) {
        return "<span class=\"" + cssClass + "\">" + content + "</span>";
    }

    public static String highlightChords(String chordRow) {
        return "<font color=" + CHORD_FONT + "><b>" + chordRow + "</b></font>";
    }

    public static String emphasizeComment(String text) {
        return "<font color=" + COMMENT_FONT + "><i>" + text + "</i></font>";
    }

    /**
     * Upper-cases the first character of a chord name and lower-cases the rest.
     */
    public static String capitalize(String chord) {
        if (chord.isEmpty()) {
            return chord;
        }
        return chord.substring(0, 1).toUpperCase(Locale.ROOT) + chord.substring(1).toLowerCase(Locale.ROOT);
    }
}
