package io.songsite.chords.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.songsite.chords.config.ConfigLoader;
import io.songsite.chords.songbook.SongFile;
import io.songsite.chords.songbook.SongRenderService;
import io.songsite.chords.songbook.SongSourceCollector;
import io.songsite.chords.writer.SongWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter stdout = new StringWriter();

    private CliApplication application() {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new SongSourceCollector(),
                new SongRenderService(),
                new SongWriter(),
                new PrintWriter(stdout));
    }

    @Test
    void printsRenderedSongToStdoutByDefault() throws Exception {
        Path song = Files.writeString(tempDir.resolve("song.chord"), "la");

        int exitCode = application().run(new String[] {song.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(stdout.toString()).isEqualTo("<span class=\"line\">la</span>\n");
    }

    @Test
    void writesEachSongIntoOutputDirectory() throws Exception {
        Path songs = Files.createDirectories(tempDir.resolve("songs"));
        Files.writeString(songs.resolve("one.chord"), "{soc}\n[C]la\n{eoc}");
        Files.writeString(songs.resolve("two.cho"), "{c: Slowly}");
        Path output = tempDir.resolve("out");

        int exitCode = application().run(new String[] {
                "--format", "paged", "--width", "20", "--output", output.toString(), songs.toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(stdout.toString()).isEmpty();
        assertThat(Files.readString(output.resolve("one.txt"), StandardCharsets.UTF_8))
                .isEqualTo("[chorus]\n<font color=#000088><b>C</b></font>\nla\n");
        assertThat(Files.readString(output.resolve("two.txt"), StandardCharsets.UTF_8))
                .isEqualTo("[comment]\nSlowly\n");
    }

    @Test
    void songsWithTheSameNameInDifferentFoldersGetTheirOwnOutput() throws Exception {
        Path songs = tempDir.resolve("songs");
        Files.writeString(Files.createDirectories(songs.resolve("a")).resolve("home.chord"), "first song");
        Files.writeString(Files.createDirectories(songs.resolve("b")).resolve("home.chord"), "second song");
        Path output = tempDir.resolve("out");

        int exitCode = application().run(new String[] {"--output", output.toString(), songs.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(output.resolve("a/home.html"), StandardCharsets.UTF_8))
                .isEqualTo("<span class=\"line\">first song</span>\n");
        assertThat(Files.readString(output.resolve("b/home.html"), StandardCharsets.UTF_8))
                .isEqualTo("<span class=\"line\">second song</span>\n");
    }

    @Test
    void explicitFilesClashingOnOutputNameFailTheRun() throws Exception {
        Path first = Files.writeString(Files.createDirectories(tempDir.resolve("a")).resolve("home.chord"), "first");
        Path second = Files.writeString(Files.createDirectories(tempDir.resolve("b")).resolve("home.chord"), "second");
        Path output = tempDir.resolve("out");

        int exitCode = application().run(new String[] {
                "--output", output.toString(), first.toString(), second.toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SONG_FAILED);
        assertThat(Files.readString(output.resolve("home.html"), StandardCharsets.UTF_8))
                .isEqualTo("<span class=\"line\">first</span>\n");
    }

    @Test
    void unreadableInputDirectoryIsReportedAsInvalidInput() throws Exception {
        Path songs = Files.createDirectories(tempDir.resolve("songs"));
        CliApplication application = new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new FailingSongSourceCollector(),
                new SongRenderService(),
                new SongWriter(),
                new PrintWriter(stdout));

        int exitCode = application.run(new String[] {songs.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(stdout.toString()).isEmpty();
    }

    @Test
    void brokenSongFailsTheRunButOthersAreRendered() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("a-broken.chord"), "{sot}\n{soc}\n");
        Path fine = Files.writeString(tempDir.resolve("b-fine.chord"), "{t: Fine}\nla");

        int exitCode = application().run(new String[] {"--format", "outline", broken.toString(), fine.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SONG_FAILED);
        assertThat(stdout.toString()).isEqualTo("File " + fine + " contains 2 blocks\n"
                + "001 {title: Fine} [UNSUPPORTED]\n--- Verse:\n002 la\n--- End verse\n");
    }

    @Test
    void missingInputIsInvalid() {
        int exitCode = application().run(new String[] {tempDir.resolve("absent.chord").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(stdout.toString()).isEmpty();
    }

    @Test
    void unknownFormatIsInvalid() {
        int exitCode = application().run(new String[] {"--format", "pdf", "song.chord"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
    }

    @Test
    void noInputsIsInvalid() {
        assertThat(application().run(new String[0])).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
    }

    @Test
    void helpExitsSuccessfully() {
        assertThat(application().run(new String[] {"--help"})).isZero();
    }

    private static final class FailingSongSourceCollector extends SongSourceCollector {

        @Override
        public List<SongFile> collect(List<Path> inputs, Set<String> extensions) {
            throw new UncheckedIOException("Failed to list songs under " + inputs.get(0),
                    new AccessDeniedException(inputs.get(0).toString()));
        }
    }
}
