package io.songsite.chords.render;

/**
 * Resolves a block style token into whatever concrete style the print layer uses.
 */
@FunctionalInterface
public interface StyleRegistry<S> {

    S resolve(BlockStyle style);
}
