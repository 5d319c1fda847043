package io.songsite.chords.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.songsite.chords.model.Block;
import io.songsite.chords.model.ChordLine;
import io.songsite.chords.model.Chorus;
import io.songsite.chords.model.Document;
import io.songsite.chords.model.HashComment;
import io.songsite.chords.model.PlainLine;
import io.songsite.chords.model.SongElement;
import io.songsite.chords.model.UnsupportedDirective;
import io.songsite.chords.model.Verse;
import io.songsite.chords.text.Chord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SongParserTest {

    private final SongParser parser = new SongParser();

    @Test
    void parsesChorusWithChordLine() {
        Document document = parser.parse("{soc}\n[C]Hello [G]world\n{eoc}").orElseThrow();

        assertThat(document.elements()).hasSize(1);
        Chorus chorus = (Chorus) document.elements().get(0);
        assertThat(chorus.explicitlyClosed()).isTrue();
        assertThat(chorus.lines()).hasSize(1);
        ChordLine line = (ChordLine) chorus.lines().get(0);
        assertThat(line.bareText()).isEqualTo("Hello world");
        assertThat(line.chords())
                .extracting(Chord::offset, Chord::text)
                .containsExactly(tuple(0, "C"), tuple(6, "G"));
    }

    @Test
    void chorusSpansOnlyTheLinesBetweenItsMarkers() {
        Document document = parser.parse("before\n{soc}\nin one\nin two\n{eoc}\nafter").orElseThrow();

        assertThat(document.elements())
                .extracting(SongElement::lineno)
                .containsExactly(1, 2, 6);
        Chorus chorus = (Chorus) document.elements().get(1);
        assertThat(chorus.lines()).containsExactly(new PlainLine(3, "in one"), new PlainLine(4, "in two"));
    }

    @Test
    void unclosedChorusIsClosedAtEndOfInput() {
        ParseResult result = parser.parse("{soc}\nla la\nla");

        assertThat(result.isParsed()).isTrue();
        List<Block> blocks = result.orElseThrow().blocks();
        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0)).isInstanceOf(Chorus.class);
        assertThat(blocks.get(0).explicitlyClosed()).isFalse();
        assertThat(blocks.get(0).lines()).hasSize(2);
    }

    @Test
    void strayEndOfChorusIsKeptAsPassThrough() {
        Document document = parser.parse("{eoc}\nfoo").orElseThrow();

        assertThat(document.elements()).containsExactly(
                new UnsupportedDirective(1, "end_of_chorus", "", "{eoc}"),
                new Verse(List.of(new PlainLine(2, "foo"))));
    }

    @Test
    void strayEndOfTabIsKeptAsPassThrough() {
        Document document = parser.parse("{eot}\nfoo").orElseThrow();

        assertThat(document.elements()).containsExactly(
                new UnsupportedDirective(1, "end_of_tab", "", "{eot}"),
                new Verse(List.of(new PlainLine(2, "foo"))));
    }

    @Test
    void hashCommentsAndIgnoredDirectivesStayInsideChorus() {
        Document document = parser.parse("{soc}\n# capo\n{textfont: x}\nla\n{eoc}").orElseThrow();

        assertThat(document.elements()).hasSize(1);
        Chorus chorus = (Chorus) document.elements().get(0);
        assertThat(chorus.explicitlyClosed()).isTrue();
        assertThat(chorus.lines()).containsExactly(
                new HashComment(2, "# capo"),
                new HashComment(3, "#{textfont: x} [IGNORED]"),
                new PlainLine(4, "la"));
    }

    @Test
    void directiveInsideChorusFailsAtItsLine() {
        ParseResult result = parser.parse("{soc}\nla\n{title: x}\n{eoc}");

        assertThat(result).isInstanceOf(ParseResult.Failed.class);
        StructuralError error = ((ParseResult.Failed) result).error();
        assertThat(error.lineno()).isEqualTo(3);
        assertThat(error.toString()).isEqualTo("Line 3: Cannot have command inside Chorus.");
    }

    @Test
    void titleAndDefineAreCapturedButInvisible() {
        Document document = parser.parse("{title: Skye Boat Song}\n{define G 320003}\nSpeed bonnie boat").orElseThrow();

        assertThat(document.metadata("title")).contains("Skye Boat Song");
        assertThat(document.metadata("define")).contains("G 320003");
        assertThat(document.metadata("subtitle")).isEmpty();
        assertThat(document.renderInline())
                .doesNotContain("Skye")
                .doesNotContain("320003")
                .isEqualTo("\n\n<span class=\"line\">Speed bonnie boat</span>");
    }

    @Test
    void everyLineBecomesExactlyOneNode() {
        Tokenizer tokenizer = new Tokenizer();
        List<String> inputs = List.of(
                "",
                "\n\n\n",
                "{unknown}\n{soc}\n{c: x}\n#\n[A]",
                "  [G]  \n\t{eot}\n{define}\n{",
                "line\r\nwith carriage return");

        for (String input : inputs) {
            assertThat(tokenizer.tokenize(input)).hasSize(input.split("\n", -1).length);
        }
    }

    @Test
    void wrappingKeepsChordOrder() {
        ChordLine line = ChordLine.of(1, "[Am]When the [F]night has [C]come and the [G]land is [Em]dark");

        List<String> fragments = line.renderPaged(12);

        List<String> chordsAfterWrap = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i += 2) {
            String row = fragments.get(i).replaceAll("<[^>]*>", "").strip();
            chordsAfterWrap.addAll(Arrays.asList(row.split("\\s+")));
        }
        List<String> original = line.chords().stream().map(Chord::text).collect(Collectors.toList());
        assertThat(fragments.size()).isGreaterThan(2);
        assertThat(chordsAfterWrap).isEqualTo(original);
    }

    @Test
    void parserCanBeSharedBetweenThreads() throws Exception {
        String song = "{title: Shared}\n[D]One [A]two\n\n{soc}\n[G]three\n{eoc}\n";
        String expected = parser.parse(song).orElseThrow().renderInline();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> parser.parse(song).orElseThrow().renderInline()));
            }
            for (Future<String> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
