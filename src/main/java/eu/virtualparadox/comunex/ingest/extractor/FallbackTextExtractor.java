package eu.virtualparadox.comunex.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks an ordered list of engines. Each engine but the last must produce text that passes
 * the acceptance test, otherwise (or when it throws) the next one is tried. The last engine's
 * output is always accepted, even when empty; only its failure is fatal.
 */
@Service
@Primary
@Slf4j
public class FallbackTextExtractor implements TextExtractor {

    private final List<PdfTextEngine> engines;

    @Autowired
    public FallbackTextExtractor(final PdfBoxTextEngine primary, final TikaTextEngine fallback) {
        this(List.of(primary, fallback));
    }

    public FallbackTextExtractor(final List<PdfTextEngine> engines) {
        if (engines == null || engines.isEmpty()) {
            throw new IllegalArgumentException("At least one text engine is required");
        }
        this.engines = List.copyOf(engines);
    }

    @Override
    public ExtractedText extract(final Path pdf) {
        final Accepted accepted = run(pdf, 0, PageTexts::hasText);
        return new ExtractedText(accepted.pages().joined(), accepted.pages().pageCount(), accepted.engine());
    }

    @Override
    public ExtractedPages extractPerPage(final Path pdf) {
        final Accepted accepted = run(pdf, 0, PageTexts::anyPageHasText);
        return new ExtractedPages(accepted.pages().pages(), accepted.pages().pageCount(), accepted.engine());
    }

    @Override
    public String firstPages(final Path pdf, final int pages) {
        try {
            return run(pdf, Math.max(1, pages), PageTexts::hasText).pages().joined();
        } catch (TextExtractionException e) {
            log.debug("No readable text in first {} pages of {}", pages, pdf.getFileName());
            return "";
        }
    }

    private Accepted run(final Path pdf, final int maxPages, final Predicate<PageTexts> acceptance) {
        Exception lastError = null;
        for (int i = 0; i < engines.size(); i++) {
            final PdfTextEngine engine = engines.get(i);
            final boolean last = i == engines.size() - 1;
            try {
                final PageTexts pages = engine.extractPages(pdf, maxPages);
                if (last || acceptance.test(pages)) {
                    return new Accepted(engine.name(), pages);
                }
                log.debug("{} produced no text for {}, trying next engine", engine.name(), pdf.getFileName());
            } catch (Exception e) {
                lastError = e;
                log.debug("{} failed on {}: {}", engine.name(), pdf.getFileName(), e.getMessage());
            }
        }
        throw new TextExtractionException("All text engines failed for " + pdf, lastError);
    }

    private record Accepted(String engine, PageTexts pages) {
    }
}
