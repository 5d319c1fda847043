package io.songsite.chords.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Greedy word wrapping for fixed-width print layout.
 *
 * <p>Words are separated on single spaces. A separator is only appended while the current fragment
 * is shorter than the width; a fragment that already fills the width receives the separator as a
 * fragment of its own, which is dropped from the result. Words wider than the width are kept whole.
 */
public final class TextReflow {

    private TextReflow() {
    }

    public static List<String> wrap(String text, int width) {
        return reflow(text, width, String::length);
    }

    /**
     * Wraps a line that still contains chord markup, measuring only the visible lyric text so that
     * the annotations never influence where a line breaks.
     */
    public static List<String> wrapChordLine(String text, int width) {
        return reflow(text, width, fragment -> ChordLineDecomposer.stripChords(fragment).length());
    }

    private static List<String> reflow(String text, int width, ToIntFunction<String> length) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be at least 1");
        }
        List<StringBuilder> fragments = new ArrayList<>();
        for (String word : text.split(" ", -1)) {
            if (fragments.isEmpty()) {
                fragments.add(new StringBuilder(word));
                continue;
            }
            StringBuilder last = fragments.get(fragments.size() - 1);
            if (length.applyAsInt(last.toString()) < width) {
                last.append(' ');
            } else {
                last = new StringBuilder(" ");
                fragments.add(last);
            }
            if (length.applyAsInt(last.toString()) + length.applyAsInt(word) <= width) {
                last.append(word);
            } else {
                fragments.add(new StringBuilder(word));
            }
        }
        List<String> wrapped = new ArrayList<>(fragments.size());
        for (StringBuilder fragment : fragments) {
            String value = fragment.toString().strip();
            if (!value.isEmpty()) {
                wrapped.add(value);
            }
        }
        return wrapped;
    }
}
