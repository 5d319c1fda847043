package io.songsite.chords.model;

import java.util.Objects;

/**
 * Opens a tablature block, whose lines are kept verbatim.
 */
public record StartTablature(int lineno, String raw) implements Directive {

    public StartTablature {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.START_TABLATURE;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String describe() {
        return String.format("%03d {start_of_tab}", lineno);
    }
}
