package io.songsite.chords.model;

import io.songsite.chords.render.Renderable;

/**
 * One tokenized input line. Exactly one node exists per physical line of the song text.
 */
public sealed interface SongLine extends Renderable
        permits Blank, HashComment, PlainLine, ChordLine, Directive {

    /**
     * 1-based position of the line in the input.
     */
    int lineno();

    LineKind kind();

    /**
     * The input text this node was built from.
     */
    String source();

    /**
     * Line-numbered debug form, as printed in song outlines.
     */
    String describe();
}
