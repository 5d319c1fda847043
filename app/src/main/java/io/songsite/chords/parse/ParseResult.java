package io.songsite.chords.parse;

import io.songsite.chords.model.Document;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one song: either the assembled document or the structural error that
 * rejected the whole input. There is no partial document.
 */
public sealed interface ParseResult {

    static ParseResult parsed(Document document) {
        return new Parsed(document);
    }

    static ParseResult failed(StructuralError error) {
        return new Failed(error);
    }

    default boolean isParsed() {
        return this instanceof Parsed;
    }

    default Optional<StructuralError> failure() {
        return this instanceof Failed failed ? Optional.of(failed.error()) : Optional.empty();
    }

    /**
     * Returns the document, or throws the structural error as a {@link StructuralException}.
     */
    default Document orElseThrow() {
        if (this instanceof Failed failed) {
            throw new StructuralException(failed.error());
        }
        return ((Parsed) this).document();
    }

    record Parsed(Document document) implements ParseResult {

        public Parsed {
            Objects.requireNonNull(document, "document");
        }
    }

    record Failed(StructuralError error) implements ParseResult {

        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
