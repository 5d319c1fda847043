package io.songsite.chords.parse;

import io.songsite.chords.model.EndChorus;
import io.songsite.chords.model.EndTablature;
import io.songsite.chords.model.HashComment;
import io.songsite.chords.model.InlineComment;
import io.songsite.chords.model.SongLine;
import io.songsite.chords.model.StartChorus;
import io.songsite.chords.model.StartTablature;
import io.songsite.chords.model.UnsupportedDirective;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a {@code {...}} line to its directive node using a fixed, ordered rule table. The first rule
 * whose pattern matches the start of the line wins. Lines no rule accepts are kept as ignored
 * hash comments, so every directive line yields exactly one node.
 */
public class DirectiveRecognizer {

    static final String IGNORED_MARKER = " [IGNORED]";

    private static final List<Rule> RULES = List.of(
            rule("\\{\\s*(comment|c)\\s*:\\s*(?<v>.*)\\}",
                    (matcher, lineno, raw) -> new InlineComment(lineno, matcher.group("v"), raw)),
            rule("\\{\\s*(start_of_chorus|soc)\\s*\\}",
                    (matcher, lineno, raw) -> new StartChorus(lineno, raw)),
            rule("\\{\\s*(end_of_chorus|eoc)\\s*\\}",
                    (matcher, lineno, raw) -> new EndChorus(lineno, raw)),
            rule("\\{\\s*(start_of_tab|sot)\\s*\\}",
                    (matcher, lineno, raw) -> new StartTablature(lineno, raw)),
            rule("\\{\\s*(end_of_tab|eot)\\s*\\}",
                    (matcher, lineno, raw) -> new EndTablature(lineno, raw)),
            rule("\\{\\s*(define)\\s+(?<v>.*)\\}",
                    (matcher, lineno, raw) -> new UnsupportedDirective(lineno, "define", matcher.group("v"), raw)),
            rule("\\{\\s*(title|t)\\s*:\\s*(?<v>.*)\\}",
                    (matcher, lineno, raw) -> new UnsupportedDirective(lineno, "title", matcher.group("v"), raw)),
            rule("\\{\\s*(subtitle|st)\\s*:\\s*(?<v>.*)\\}",
                    (matcher, lineno, raw) -> new UnsupportedDirective(lineno, "subtitle", matcher.group("v"), raw)));

    /**
     * @param line   the directive line, already stripped
     * @param lineno its 1-based line number
     */
    public SongLine recognize(String line, int lineno) {
        Objects.requireNonNull(line, "line");
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(line);
            if (matcher.lookingAt()) {
                return rule.factory().create(matcher, lineno, line);
            }
        }
        return new HashComment(lineno, "#" + line + IGNORED_MARKER);
    }

    private static Rule rule(String regex, DirectiveFactory factory) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), factory);
    }

    @FunctionalInterface
    private interface DirectiveFactory {
        SongLine create(Matcher matcher, int lineno, String raw);
    }

    private record Rule(Pattern pattern, DirectiveFactory factory) {
    }
}
