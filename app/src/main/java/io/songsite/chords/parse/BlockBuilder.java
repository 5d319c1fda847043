package io.songsite.chords.parse;

import io.songsite.chords.model.SongLine;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable, open-then-closed accumulator for the lines of one block while it is being assembled.
 */
final class BlockBuilder {

    private final String label;
    private final int startLine;
    private final List<SongLine> lines = new ArrayList<>();
    private boolean closed;
    private int closedAt;

    BlockBuilder(String label, int startLine) {
        this.label = label;
        this.startLine = startLine;
    }

    void append(SongLine line) {
        if (closed) {
            throw new StructuralException(new StructuralError(line.lineno(), line.source(),
                    String.format("Cannot append to %s started at line %d, it has been closed on line %d",
                            label, startLine, closedAt)));
        }
        lines.add(line);
    }

    void close(int lineno) {
        closed = true;
        closedAt = lineno;
    }

    String label() {
        return label;
    }

    int startLine() {
        return startLine;
    }

    int lastLine() {
        return lines.isEmpty() ? startLine : lines.get(lines.size() - 1).lineno();
    }

    List<SongLine> lines() {
        return List.copyOf(lines);
    }
}
