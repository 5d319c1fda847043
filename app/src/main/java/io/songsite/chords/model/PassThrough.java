package io.songsite.chords.model;

/**
 * Lines that may appear between blocks without belonging to one.
 */
public sealed interface PassThrough extends SongElement
        permits Blank, HashComment, InlineComment, UnsupportedDirective {
}
