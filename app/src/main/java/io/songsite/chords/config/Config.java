package io.songsite.chords.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<Path> inputs,
        OutputFormat outputFormat,
        int pageWidth,
        Optional<Path> outputDirectory,
        Set<String> songExtensions,
        LogFormat logFormat,
        boolean verbose
) {

    public static final int DEFAULT_PAGE_WIDTH = 60;
    private static final Set<String> DEFAULT_SONG_EXTENSIONS = Set.of("chord", "chordpro", "cho", "crd");

    public Config {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one song file or directory must be provided");
        }
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        if (pageWidth < 1) {
            throw new IllegalArgumentException("pageWidth must be at least 1");
        }
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        songExtensions = songExtensions == null || songExtensions.isEmpty()
                ? DEFAULT_SONG_EXTENSIONS
                : songExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
