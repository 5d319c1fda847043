package io.songsite.chords.parse;

import io.songsite.chords.model.SongLine;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses song text into a {@link io.songsite.chords.model.Document}. Instances hold no per-song
 * state and may be shared between threads.
 */
public class SongParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(SongParser.class);

    private final Tokenizer tokenizer;
    private final BlockAssembler assembler;

    public SongParser() {
        this(new Tokenizer(), new BlockAssembler());
    }

    public SongParser(Tokenizer tokenizer, BlockAssembler assembler) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * @param text song text with {@code \n} line endings
     */
    public ParseResult parse(String text) {
        List<SongLine> tokens = tokenizer.tokenize(text);
        LOGGER.debug("Tokenized {} lines", tokens.size());
        return assembler.assemble(tokens);
    }
}
