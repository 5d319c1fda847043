package io.songsite.chords.songbook;

import io.songsite.chords.config.OutputFormat;
import io.songsite.chords.logging.SimpleJsonLayout;
import io.songsite.chords.model.Document;
import io.songsite.chords.parse.ParseResult;
import io.songsite.chords.parse.SongParser;
import io.songsite.chords.parse.StructuralError;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Parses and renders a batch of songs. A song that cannot be read or structured is logged and
 * reported in {@link RenderOutcome#failedFiles()}; the rest of the batch still runs.
 */
public class SongRenderService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SongRenderService.class);

    private final SongParser parser;
    private final SongRendererFactory rendererFactory;

    public SongRenderService() {
        this(new SongParser(), SongRendererFactory.withDefaults());
    }

    public SongRenderService(SongParser parser, SongRendererFactory rendererFactory) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
    }

    /**
     * Reads every file, then renders the ones that could be read. Unreadable files are reported
     * first in {@link RenderOutcome#failedFiles()}.
     */
    public RenderOutcome renderFiles(List<SongFile> files, OutputFormat format, int width) {
        List<SongSource> sources = new ArrayList<>(files.size());
        List<String> unreadable = new ArrayList<>();
        for (SongFile file : files) {
            try {
                sources.add(SongSource.read(file));
            } catch (IOException ex) {
                LOGGER.error("Could not read {}: {}", file.file(), ex.getMessage(), ex);
                unreadable.add(file.file().toString());
            }
        }
        RenderOutcome rendered = render(sources, format, width);
        if (unreadable.isEmpty()) {
            return rendered;
        }
        unreadable.addAll(rendered.failedFiles());
        return new RenderOutcome(rendered.results(), unreadable);
    }

    public RenderOutcome render(List<SongSource> sources, OutputFormat format, int width) {
        if (sources == null || sources.isEmpty()) {
            return new RenderOutcome(List.of(), List.of());
        }
        SongRenderer renderer = rendererFactory.select(format);
        List<RenderedSong> results = new ArrayList<>();
        List<String> failedFiles = new ArrayList<>();
        for (SongSource source : sources) {
            renderInto(source, renderer, width, results, failedFiles);
        }
        return new RenderOutcome(results, failedFiles);
    }

    private void renderInto(SongSource source, SongRenderer renderer, int width,
                            List<RenderedSong> results, List<String> failedFiles) {
        Optional<RenderedSong> rendered = renderOne(source, renderer, width);
        if (rendered.isPresent()) {
            results.add(rendered.get());
        } else {
            failedFiles.add(source.path());
        }
    }

    private Optional<RenderedSong> renderOne(SongSource source, SongRenderer renderer, int width) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(SimpleJsonLayout.SONG_KEY, source.path())) {
            ParseResult result = parser.parse(source.text());
            if (result instanceof ParseResult.Failed failed) {
                StructuralError error = failed.error();
                LOGGER.error("Could not process {}: {} (line {}: {})",
                        source.path(), error.message(), error.lineno(), error.content());
                return Optional.empty();
            }
            Document document = result.orElseThrow();
            LOGGER.info("Rendering {} ({} elements) as {}", source.path(), document.size(), renderer.fileExtension());
            return Optional.of(new RenderedSong(source.path(), source.relativePath(), renderer.fileExtension(),
                    renderer.render(source, document, width)));
        }
    }
}
