package io.songsite.chords.cli;

import io.songsite.chords.config.LogFormat;
import io.songsite.chords.config.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "songsite-chords", mixinStandardHelpOptions = true,
        description = "Renders chord-annotated song files as HTML, paged text or a structural outline")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*", description = "Song files or directories containing songs")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class,
            description = "Output format: html, paged or outline")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--width", description = "Page width in characters for paged output", paramLabel = "COLUMNS")
    private Integer pageWidth;

    @CommandLine.Option(names = "--output", description = "Directory receiving rendered files instead of stdout", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Log parser decisions at debug level")
    private boolean verbose;

    public List<Path> inputs() {
        return inputs == null ? List.of() : List.copyOf(inputs);
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public Integer pageWidth() {
        return pageWidth;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
