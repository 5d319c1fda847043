package io.songsite.chords.model;

import java.util.Objects;

public record EndChorus(int lineno, String raw) implements Directive {

    public EndChorus {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.END_CHORUS;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String describe() {
        return String.format("%03d {end_of_chorus}", lineno);
    }
}
