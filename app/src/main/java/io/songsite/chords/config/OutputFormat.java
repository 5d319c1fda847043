package io.songsite.chords.config;

/**
 * What the CLI produces for each song.
 */
public enum OutputFormat {
    /** Inline markup for the web pages. */
    HTML,
    /** Width-wrapped paragraphs for print layout. */
    PAGED,
    /** Line-numbered dump of the parsed structure. */
    OUTLINE;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return HTML;
        }
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + raw);
    }
}
