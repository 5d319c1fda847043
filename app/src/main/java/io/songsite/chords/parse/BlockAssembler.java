package io.songsite.chords.parse;

import io.songsite.chords.model.Chorus;
import io.songsite.chords.model.Document;
import io.songsite.chords.model.EndChorus;
import io.songsite.chords.model.EndTablature;
import io.songsite.chords.model.LineKind;
import io.songsite.chords.model.PassThrough;
import io.songsite.chords.model.SongElement;
import io.songsite.chords.model.SongLine;
import io.songsite.chords.model.StartChorus;
import io.songsite.chords.model.StartTablature;
import io.songsite.chords.model.Tablature;
import io.songsite.chords.model.UnsupportedDirective;
import io.songsite.chords.model.Verse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups tokenized lines into verses, choruses and tablatures.
 *
 * <p>Each round tries, in order, to take the pass-through lines at the cursor, then a verse, a
 * chorus and a tablature. A round that takes nothing means the input cannot be structured. Blocks
 * left open at the end of the input are closed there; end markers without an open block are kept
 * as unsupported directives.
 */
public class BlockAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockAssembler.class);

    public ParseResult assemble(List<SongLine> tokens) {
        try {
            return ParseResult.parsed(new Document(assembleElements(new TokenCursor(tokens))));
        } catch (StructuralException ex) {
            LOGGER.debug("Rejected song structure at line {}: {}", ex.error().lineno(), ex.getMessage());
            return ParseResult.failed(ex.error());
        }
    }

    private List<SongElement> assembleElements(TokenCursor cursor) {
        List<SongElement> elements = new ArrayList<>();
        while (cursor.hasNext()) {
            int before = cursor.position();
            elements.addAll(consumePassThrough(cursor));
            consumeVerse(cursor).ifPresent(elements::add);
            consumeChorus(cursor).ifPresent(elements::add);
            consumeTablature(cursor).ifPresent(elements::add);
            if (cursor.position() == before) {
                SongLine line = cursor.peek();
                throw new StructuralException(new StructuralError(line.lineno(), line.source(),
                        String.format("Cannot make sense of \"%s\"", line.describe())));
            }
        }
        return elements;
    }

    private List<PassThrough> consumePassThrough(TokenCursor cursor) {
        List<PassThrough> consumed = new ArrayList<>();
        while (cursor.hasNext()) {
            SongLine line = cursor.peek();
            switch (line.kind()) {
                case BLANK, HASH_COMMENT, INLINE_COMMENT, UNSUPPORTED_DIRECTIVE -> consumed.add((PassThrough) cursor.next());
                case END_CHORUS, END_TABLATURE -> consumed.add(strayEndMarker(cursor.next()));
                default -> {
                    return consumed;
                }
            }
        }
        return consumed;
    }

    private UnsupportedDirective strayEndMarker(SongLine marker) {
        String name = marker.kind() == LineKind.END_CHORUS ? "end_of_chorus" : "end_of_tab";
        LOGGER.warn("Line {}: {} has no block to close, ignoring it", marker.lineno(), marker.source());
        return new UnsupportedDirective(marker.lineno(), name, "", marker.source());
    }

    private Optional<Verse> consumeVerse(TokenCursor cursor) {
        if (!cursor.hasNext() || !cursor.peek().kind().isLyric()) {
            return Optional.empty();
        }
        BlockBuilder builder = new BlockBuilder("Verse", cursor.peek().lineno());
        while (cursor.hasNext() && cursor.peek().kind().isLyric()) {
            builder.append(cursor.next());
        }
        builder.close(builder.lastLine());
        return Optional.of(new Verse(builder.lines()));
    }

    private Optional<Chorus> consumeChorus(TokenCursor cursor) {
        if (!cursor.hasNext() || cursor.peek().kind() != LineKind.START_CHORUS) {
            return Optional.empty();
        }
        StartChorus start = (StartChorus) cursor.next();
        BlockBuilder builder = new BlockBuilder("Chorus", start.lineno());
        Optional<EndChorus> end = consumeBody(cursor, builder, LineKind.END_CHORUS).map(EndChorus.class::cast);
        return Optional.of(new Chorus(start, builder.lines(), end));
    }

    private Optional<Tablature> consumeTablature(TokenCursor cursor) {
        if (!cursor.hasNext() || cursor.peek().kind() != LineKind.START_TABLATURE) {
            return Optional.empty();
        }
        StartTablature start = (StartTablature) cursor.next();
        BlockBuilder builder = new BlockBuilder("Tablature", start.lineno());
        Optional<EndTablature> end = consumeBody(cursor, builder, LineKind.END_TABLATURE).map(EndTablature.class::cast);
        return Optional.of(new Tablature(start, builder.lines(), end));
    }

    /**
     * Appends lines until the end marker, which is returned. Comments and blank lines belong to the
     * block; any other directive is a structural error.
     */
    private Optional<SongLine> consumeBody(TokenCursor cursor, BlockBuilder builder, LineKind endKind) {
        while (cursor.hasNext()) {
            SongLine line = cursor.next();
            if (line.kind() == endKind) {
                builder.close(line.lineno());
                return Optional.of(line);
            }
            if (line.kind().isDirective() && line.kind() != LineKind.INLINE_COMMENT) {
                throw new StructuralException(new StructuralError(line.lineno(), line.source(),
                        String.format("Line %d: Cannot have command inside %s.", line.lineno(), builder.label())));
            }
            builder.append(line);
        }
        LOGGER.warn("{} started at line {} is never closed, closing it at the end of the song",
                builder.label(), builder.startLine());
        builder.close(builder.lastLine());
        return Optional.empty();
    }
}
