package eu.virtualparadox.comunex.ingest;

import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import eu.virtualparadox.comunex.catalog.entity.TextEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.ingest.cache.TextCache;
import eu.virtualparadox.comunex.ingest.extractor.ExtractedPages;
import eu.virtualparadox.comunex.ingest.extractor.ExtractedText;
import eu.virtualparadox.comunex.ingest.extractor.TextExtractor;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Text of stored PDFs, served from the on-disk cache when possible and extracted otherwise.
 * A fresh extraction writes both cache variants and records the text in the catalog.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentTextService {

    private final TextExtractor textExtractor;
    private final TextCache textCache;
    private final DocumentCatalogService catalog;
    private final WorkspaceLayout layout;

    /**
     * Whole-document text.
     *
     * @throws eu.virtualparadox.comunex.ingest.extractor.TextExtractionException when no engine can read the PDF
     */
    public TextResult<ExtractedText> text(final PdfEntity pdf) {
        final Optional<TextEntity> record = catalog.findText(pdf.getHash());
        if (record.isPresent()) {
            final Optional<String> cached = textCache.readText(record.get().getTextPath());
            if (cached.isPresent()) {
                return TextResult.cached(new ExtractedText(cached.get(), record.get().getPages(), record.get().getExtractor()));
            }
            log.warn("Text cache missing for {}, extracting again", pdf.getHash());
        }

        final ExtractedPages pages = extractAndCache(pdf);
        return TextResult.fresh(new ExtractedText(pages.joined(), pages.pageCount(), pages.engine()));
    }

    /**
     * Per-page text. A cache read with any page file missing counts as a miss.
     *
     * @throws eu.virtualparadox.comunex.ingest.extractor.TextExtractionException when no engine can read the PDF
     */
    public TextResult<ExtractedPages> pages(final PdfEntity pdf) {
        final Optional<ExtractedPages> cached = cachedPages(pdf);
        if (cached.isPresent()) {
            return TextResult.cached(cached.get());
        }
        return TextResult.fresh(extractAndCache(pdf));
    }

    /**
     * Per-page text from the cache only; never extracts.
     */
    public Optional<ExtractedPages> cachedPages(final PdfEntity pdf) {
        return catalog.findText(pdf.getHash())
                .flatMap(record -> textCache.readPages(textDir(pdf), pdf.getHash(), record.getPages())
                        .map(pages -> new ExtractedPages(pages, record.getPages(), record.getExtractor())));
    }

    /**
     * Whole-document text from the cache only; never extracts.
     */
    public Optional<String> cachedText(final PdfEntity pdf) {
        return catalog.findText(pdf.getHash())
                .flatMap(record -> textCache.readText(record.getTextPath()));
    }

    private ExtractedPages extractAndCache(final PdfEntity pdf) {
        final ExtractedPages pages = textExtractor.extractPerPage(pdf.getLocalPath());
        final String whole = pages.joined();
        final Path dir = textDir(pdf);
        try {
            textCache.writePages(dir, pdf.getHash(), pages.pages());
            final Path textPath = textCache.writeText(dir, pdf.getHash(), whole);
            catalog.recordText(TextEntity.builder()
                    .hash(pdf.getHash())
                    .textPath(textPath)
                    .extractedAt(Instant.now())
                    .extractor(pages.engine())
                    .pages(pages.pages().size())
                    .textLength(whole.length())
                    .build());
        } catch (IOException e) {
            log.warn("Could not cache text of {}: {}", pdf.getHash(), e.getMessage());
        }
        return pages;
    }

    private Path textDir(final PdfEntity pdf) {
        return layout.textDir(pdf.getDetectedYear());
    }

    /**
     * @param value     the text
     * @param fromCache {@code true} when no extraction ran
     */
    public record TextResult<T>(T value, boolean fromCache) {

        static <T> TextResult<T> cached(final T value) {
            return new TextResult<>(value, true);
        }

        static <T> TextResult<T> fresh(final T value) {
            return new TextResult<>(value, false);
        }
    }
}
