package io.songsite.chords.model;

import java.util.Objects;

/**
 * Opens a chorus block.
 */
public record StartChorus(int lineno, String raw) implements Directive {

    public StartChorus {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.START_CHORUS;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String describe() {
        return String.format("%03d {start_of_chorus}", lineno);
    }
}
