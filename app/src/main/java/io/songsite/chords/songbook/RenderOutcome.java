package io.songsite.chords.songbook;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of rendered songs and the files that could not be processed in a batch run.
 */
public record RenderOutcome(List<RenderedSong> results,
                            List<String> failedFiles) {

    public RenderOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failedFiles = List.copyOf(Objects.requireNonNull(failedFiles, "failedFiles"));
    }

    public int processedFiles() {
        return results.size();
    }

    public boolean hasFailures() {
        return !failedFiles.isEmpty();
    }
}
