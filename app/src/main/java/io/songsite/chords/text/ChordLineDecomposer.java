package io.songsite.chords.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates bracketed chord markup ({@code [Am]}) from the lyrics it annotates.
 *
 * <p>Chord offsets are columns of the bare text. Two chords never touch: when a chord would start
 * at or before the end of its predecessor it is pushed one column past it, and the chords after it
 * keep their original spacing relative to one another.
 */
public final class ChordLineDecomposer {

    private static final Pattern CHORD = Pattern.compile("\\[([^\\]]*)\\]");

    private ChordLineDecomposer() {
    }

    public static boolean containsChord(String line) {
        return line != null && CHORD.matcher(line).find();
    }

    /**
     * Removes every chord annotation, leaving the visible lyric text.
     */
    public static String stripChords(String line) {
        return CHORD.matcher(line).replaceAll("");
    }

    public static DecomposedLine decompose(String line) {
        Matcher matcher = CHORD.matcher(line);
        List<Chord> chords = new ArrayList<>();
        int removed = 0;
        int previousRaw = 0;
        Chord previous = null;
        while (matcher.find()) {
            String name = matcher.group(1);
            int raw = matcher.start() - removed;
            removed += matcher.end() - matcher.start();
            Chord chord;
            if (previous == null) {
                chord = new Chord(raw, name);
            } else {
                int gap = raw - previousRaw - previous.text().length();
                chord = new Chord(previous.end() + Math.max(gap, 1), name);
            }
            chords.add(chord);
            previous = chord;
            previousRaw = raw;
        }
        return new DecomposedLine(stripChords(line), chords);
    }

    /**
     * Lays the chords out on a single row, padding with spaces so that every chord starts at its offset.
     */
    public static String chordRow(List<Chord> chords, UnaryOperator<String> formatter) {
        StringBuilder row = new StringBuilder();
        for (Chord chord : chords) {
            while (row.length() < chord.offset()) {
                row.append(' ');
            }
            row.append(formatter.apply(chord.text()));
        }
        return row.toString();
    }

    public static String chordRow(List<Chord> chords) {
        return chordRow(chords, UnaryOperator.identity());
    }
}
