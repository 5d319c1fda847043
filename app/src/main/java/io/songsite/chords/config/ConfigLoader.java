package io.songsite.chords.config;

import io.songsite.chords.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUTS = "CHORDS_INPUTS";
    static final String ENV_OUTPUT_FORMAT = "CHORDS_OUTPUT_FORMAT";
    static final String ENV_PAGE_WIDTH = "CHORDS_PAGE_WIDTH";
    static final String ENV_OUTPUT_DIR = "CHORDS_OUTPUT_DIR";
    static final String ENV_SONG_EXTENSIONS = "CHORDS_SONG_EXTENSIONS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "CHORDS_VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = resolveInputs(arguments);
        OutputFormat outputFormat = resolveOutputFormat(arguments);
        int pageWidth = resolvePageWidth(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);

        Optional<Path> outputDirectory = Optional.ofNullable(arguments.outputDirectory())
                .or(() -> environmentReader.get(ENV_OUTPUT_DIR)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));

        Set<String> songExtensions = environmentReader.get(ENV_SONG_EXTENSIONS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseSongExtensions)
                .orElse(Set.of());

        return new Config(inputs, outputFormat, pageWidth, outputDirectory, songExtensions, logFormat, verbose);
    }

    private List<Path> resolveInputs(CliArguments arguments) {
        if (!arguments.inputs().isEmpty()) {
            return arguments.inputs();
        }
        return environmentReader.get(ENV_INPUTS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseInputs)
                .orElseThrow(() -> new IllegalArgumentException("at least one song file or directory must be provided"));
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.outputFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_OUTPUT_FORMAT)
                .map(OutputFormat::from)
                .orElse(OutputFormat.HTML);
    }

    private int resolvePageWidth(CliArguments arguments) {
        Integer width = arguments.pageWidth();
        if (width != null) {
            if (width < 1) {
                throw new IllegalArgumentException("--width must be at least 1");
            }
            return width;
        }
        return environmentReader.get(ENV_PAGE_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePageWidth)
                .orElse(Config.DEFAULT_PAGE_WIDTH);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.get(ENV_VERBOSE)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parsePageWidth(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_PAGE_WIDTH + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_PAGE_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<Path> parseInputs(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(Path::of)
                .collect(Collectors.toList());
    }

    private static Set<String> parseSongExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
