package io.songsite.chords.parse;

import java.util.Objects;

/**
 * Runtime exception carrying a {@link StructuralError} for callers that prefer exceptions over
 * inspecting a {@link ParseResult}.
 */
public class StructuralException extends RuntimeException {

    private final StructuralError error;

    public StructuralException(StructuralError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public StructuralError error() {
        return error;
    }
}
