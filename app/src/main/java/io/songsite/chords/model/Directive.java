package io.songsite.chords.model;

import java.util.List;

/**
 * A brace-delimited control line such as {@code {start_of_chorus}}. Directives are invisible in
 * both renderings unless they carry text for the reader.
 */
public sealed interface Directive extends SongLine
        permits StartChorus, EndChorus, StartTablature, EndTablature, InlineComment, UnsupportedDirective {

    @Override
    default String renderInline() {
        return "";
    }

    @Override
    default List<String> renderPaged(int width) {
        return List.of();
    }
}
