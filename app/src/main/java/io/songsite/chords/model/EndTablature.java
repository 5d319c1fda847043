package io.songsite.chords.model;

import java.util.Objects;

public record EndTablature(int lineno, String raw) implements Directive {

    public EndTablature {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public LineKind kind() {
        return LineKind.END_TABLATURE;
    }

    @Override
    public String source() {
        return raw;
    }

    @Override
    public String describe() {
        return String.format("%03d {end_of_tab}", lineno);
    }
}
