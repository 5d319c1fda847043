package io.songsite.chords.render;

import java.util.List;
import java.util.Objects;

/**
 * A paragraph of print output: wrapped fragments sharing one style.
 */
public record PagedBlock(BlockStyle style, List<String> fragments) {

    public PagedBlock {
        Objects.requireNonNull(style, "style");
        fragments = List.copyOf(Objects.requireNonNull(fragments, "fragments"));
    }

    public <S> S resolveStyle(StyleRegistry<S> registry) {
        return Objects.requireNonNull(registry, "registry").resolve(style);
    }

    public String text() {
        return String.join("\n", fragments);
    }
}
