package io.songsite.chords.songbook;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SongSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void readsUtf8AndNormalizesLineEndings() throws Exception {
        Path file = tempDir.resolve("cafe.chord");
        Files.writeString(file, "\uFEFF{t: Café}\r\n[C]Là\rfin", StandardCharsets.UTF_8);

        SongSource source = SongSource.read(new SongFile(file, Path.of("folk/cafe.chord")));

        assertThat(source.path()).isEqualTo(file.toString());
        assertThat(source.relativePath()).isEqualTo(Path.of("folk/cafe.chord"));
        assertThat(source.text()).isEqualTo("{t: Café}\n[C]Là\nfin");
    }
}
