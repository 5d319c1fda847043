package io.songsite.chords.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.songsite.chords.render.BlockStyle;
import io.songsite.chords.render.PagedBlock;
import io.songsite.chords.text.Chord;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SongLineRenderingTest {

    @Test
    void chordLineRendersChordRowAboveLyrics() {
        ChordLine line = ChordLine.of(1, "[C]Hello [G]world");

        assertThat(line.renderInline()).isEqualTo(
                "<span class=\"chords\">C     G</span>\n<span class=\"lyrics\">Hello world</span>\n");
    }

    @Test
    void chordLinePagesCapitalizedChordsPerWrappedFragment() {
        ChordLine line = ChordLine.of(1, "[g]hello [c]world");

        assertThat(line.renderPaged(60)).containsExactly(
                "<font color=#000088><b>G     C</b></font>", "hello world");
        assertThat(line.renderPaged(5)).containsExactly(
                "<font color=#000088><b>G</b></font>", "hello",
                "<font color=#000088><b>C</b></font>", "world");
    }

    @Test
    void chordLineRejectsTouchingChords() {
        Throwable thrown = catchThrowable(() ->
                new ChordLine(3, "x", "x", List.of(new Chord(0, "Am"), new Chord(2, "G"))));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("line 3");
    }

    @Test
    void plainLineIsWrappedInLineSpan() {
        PlainLine line = new PlainLine(2, "Oh the summertime is coming");

        assertThat(line.renderInline()).isEqualTo("<span class=\"line\">Oh the summertime is coming</span>");
        assertThat(line.renderPaged(14)).containsExactly("Oh the", "summertime is", "coming");
    }

    @Test
    void commentIsEmphasizedInsideBlocksAndStyledOutsideThem() {
        InlineComment comment = new InlineComment(4, "Play it slow", "{c: Play it slow}");

        assertThat(comment.renderInline()).isEqualTo("<span class=\"comment\">Play it slow</span>\n");
        assertThat(comment.renderPaged(60)).containsExactly("<font color=#444444><i>Play it slow</i></font>");
        assertThat(comment.toPagedBlock(60)).contains(new PagedBlock(BlockStyle.COMMENT, List.of("Play it slow")));
    }

    @Test
    void hiddenLinesRenderNothing() {
        HashComment hashComment = new HashComment(1, "# capo 3");
        UnsupportedDirective title = new UnsupportedDirective(2, "title", "Song", "{title: Song}");
        StartChorus start = new StartChorus(3, "{soc}");

        assertThat(hashComment.renderInline()).isEmpty();
        assertThat(hashComment.toPagedBlock(60)).isEmpty();
        assertThat(title.renderInline()).isEmpty();
        assertThat(title.renderPaged(60)).isEmpty();
        assertThat(title.toPagedBlock(60)).isEmpty();
        assertThat(start.renderInline()).isEmpty();
        assertThat(start.renderPaged(60)).isEmpty();
    }

    @Test
    void blankLineIsAPagedBreakBetweenBlocks() {
        Blank blank = new Blank(7);

        assertThat(blank.renderInline()).isEmpty();
        assertThat(blank.toPagedBlock(60)).contains(new PagedBlock(BlockStyle.VERSE, List.of("<br/>")));
        assertThat(blank.describe()).isEqualTo("007 ");
    }

    @Test
    void describeUsesZeroPaddedLineNumbers() {
        assertThat(new UnsupportedDirective(12, "title", "Song", "{t: Song}").describe())
                .isEqualTo("012 {title: Song} [UNSUPPORTED]");
        assertThat(new InlineComment(3, "hi", "{c: hi}").describe()).isEqualTo("003 {comment: hi}");
        assertThat(ChordLine.of(5, "[C]la [F]la").describe()).isEqualTo("    C  F\n005 la la");
        assertThat(new EndTablature(9, "{eot}").describe()).isEqualTo("009 {end_of_tab}");
    }

    @Test
    void kindsSeparateLyricsFromDirectives() {
        assertThat(LineKind.CHORD.isLyric()).isTrue();
        assertThat(LineKind.PLAIN.isDirective()).isFalse();
        assertThat(LineKind.INLINE_COMMENT.isDirective()).isTrue();
        assertThat(LineKind.HASH_COMMENT.isDirective()).isFalse();
        assertThat(Optional.of(LineKind.BLANK).filter(LineKind::isLyric)).isEmpty();
    }
}
