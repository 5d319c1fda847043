package io.songsite.chords.songbook;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands the paths given on the command line into song files. Files named explicitly are always
 * taken; directories are searched recursively for the configured song extensions and keep their
 * layout below the directory.
 */
public class SongSourceCollector {

    public List<SongFile> collect(List<Path> inputs, Set<String> extensions) {
        List<SongFile> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                files.addAll(walk(input, extensions));
            } else if (Files.isRegularFile(input)) {
                files.add(SongFile.named(input));
            } else {
                throw new IllegalArgumentException("Input path does not exist: " + input);
            }
        }
        return files;
    }

    private List<SongFile> walk(Path directory, Set<String> extensions) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> extensions.contains(extensionOf(path)))
                    .sorted()
                    .map(path -> new SongFile(path, directory.relativize(path)))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list songs under " + directory, ex);
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
