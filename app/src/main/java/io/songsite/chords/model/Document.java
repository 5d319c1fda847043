package io.songsite.chords.model;

import io.songsite.chords.render.PagedBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An assembled song: blocks and the pass-through lines between them, in input order.
 */
public record Document(List<SongElement> elements) {

    public Document {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        for (int i = 1; i < elements.size(); i++) {
            if (elements.get(i).lineno() <= elements.get(i - 1).lineno()) {
                throw new IllegalArgumentException("Line numbers must increase, got " + elements.get(i).lineno()
                        + " after " + elements.get(i - 1).lineno());
            }
        }
    }

    public int size() {
        return elements.size();
    }

    public List<Block> blocks() {
        List<Block> blocks = new ArrayList<>();
        for (SongElement element : elements) {
            if (element instanceof Block block) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    /**
     * Value of the first unsupported directive with the given name, e.g. {@code title}.
     */
    public Optional<String> metadata(String name) {
        for (SongElement element : elements) {
            if (element instanceof UnsupportedDirective directive && directive.name().equalsIgnoreCase(name)) {
                return Optional.of(directive.value());
            }
        }
        return Optional.empty();
    }

    public String renderInline() {
        return elements.stream()
                .map(SongElement::renderInline)
                .collect(Collectors.joining("\n"));
    }

    public List<PagedBlock> renderPaged(int width) {
        List<PagedBlock> paged = new ArrayList<>();
        for (SongElement element : elements) {
            element.toPagedBlock(width).ifPresent(paged::add);
        }
        return paged;
    }

    public String describe() {
        return elements.stream()
                .map(SongElement::describe)
                .collect(Collectors.joining("\n"));
    }
}
