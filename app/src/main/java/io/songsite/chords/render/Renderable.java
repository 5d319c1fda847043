package io.songsite.chords.render;

import java.util.List;

/**
 * Rendering contract shared by every line and block of a song.
 *
 * <p>Both projections are pure: they can be called any number of times, in any order and from any
 * thread on an assembled document.
 */
public interface Renderable {

    /**
     * Markup for screen display, built from {@code <span class="...">} wrappers.
     */
    String renderInline();

    /**
     * Text fragments for print layout, one per physical output line, none wider than {@code width}
     * visible characters unless a single word is.
     */
    List<String> renderPaged(int width);
}
