package io.songsite.chords.cli;

import io.songsite.chords.config.Config;
import io.songsite.chords.config.ConfigLoader;
import io.songsite.chords.config.SystemEnvironmentReader;
import io.songsite.chords.logging.LoggingConfigurator;
import io.songsite.chords.songbook.RenderOutcome;
import io.songsite.chords.songbook.RenderedSong;
import io.songsite.chords.songbook.SongFile;
import io.songsite.chords.songbook.SongRenderService;
import io.songsite.chords.songbook.SongSourceCollector;
import io.songsite.chords.writer.SongWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and render service.
 *
 * <p>Exit codes: {@code 0} when every song rendered, {@code 1} when at least one song failed,
 * {@code 2} for invalid arguments or configuration.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_SONG_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final SongSourceCollector sourceCollector;
    private final SongRenderService renderService;
    private final SongWriter songWriter;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SongSourceCollector(), new SongRenderService(),
                new SongWriter(), new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader,
                   SongSourceCollector sourceCollector,
                   SongRenderService renderService,
                   SongWriter songWriter,
                   PrintWriter out) {
        this.configLoader = configLoader;
        this.sourceCollector = sourceCollector;
        this.renderService = renderService;
        this.songWriter = songWriter;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        List<SongFile> files;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            files = sourceCollector.collect(config.inputs(), config.songExtensions());
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (UncheckedIOException ex) {
            LOGGER.error("Could not collect songs: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        LOGGER.info("Rendering {} song(s) as {} (width={})", files.size(), config.outputFormat(), config.pageWidth());

        RenderOutcome outcome = renderService.renderFiles(files, config.outputFormat(), config.pageWidth());
        int writeFailures = 0;
        Set<Path> written = new HashSet<>();
        for (RenderedSong song : outcome.results()) {
            if (config.outputDirectory().isPresent() && !written.add(song.outputPath())) {
                LOGGER.error("Not writing {}: another song already went to {}", song.sourcePath(), song.outputPath());
                writeFailures++;
                continue;
            }
            try {
                emit(config, song);
            } catch (UncheckedIOException ex) {
                LOGGER.error("Could not write output for {}: {}", song.sourcePath(), ex.getMessage(), ex);
                writeFailures++;
            }
        }
        out.flush();

        if (outcome.hasFailures()) {
            LOGGER.warn("Rendering failed for files: {}", String.join(", ", outcome.failedFiles()));
        }
        LOGGER.info("Rendered {} of {} song(s)", outcome.processedFiles() - writeFailures, files.size());
        return outcome.hasFailures() || writeFailures > 0 ? EXIT_SONG_FAILED : EXIT_OK;
    }

    private void emit(Config config, RenderedSong song) {
        if (config.outputDirectory().isPresent()) {
            Path target = songWriter.write(config.outputDirectory().get(), song);
            LOGGER.debug("Wrote {}", target);
        } else {
            songWriter.print(out, song);
        }
    }
}
