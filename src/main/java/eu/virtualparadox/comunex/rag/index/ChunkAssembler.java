package eu.virtualparadox.comunex.rag.index;

import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.ingest.DocumentTextService;
import eu.virtualparadox.comunex.ingest.extractor.ExtractedPages;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns cached text of dated documents into chunks: one per non-blank page, or a single
 * page-0 chunk when only the whole text is cached. Documents without cached text are skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChunkAssembler {

    private final DocumentCatalogService catalog;
    private final DocumentTextService textService;

    /**
     * @param years target years; every dated document when empty
     */
    public List<Chunk> assemble(final Collection<Integer> years) {
        final List<PdfEntity> documents = new ArrayList<>(catalog.listByYears(years));
        documents.sort(Comparator.comparing(PdfEntity::getDetectedYear).thenComparing(PdfEntity::getHash));

        final List<Chunk> chunks = new ArrayList<>();
        int skipped = 0;
        for (final PdfEntity pdf : documents) {
            final List<Chunk> documentChunks = chunksOf(pdf);
            if (documentChunks.isEmpty()) {
                skipped++;
            }
            chunks.addAll(documentChunks);
        }
        log.info("Assembled {} chunks from {} documents ({} without text)", chunks.size(), documents.size(), skipped);
        return chunks;
    }

    List<Chunk> chunksOf(final PdfEntity pdf) {
        final List<Chunk> chunks = new ArrayList<>();
        final Optional<ExtractedPages> pages = textService.cachedPages(pdf);
        if (pages.isPresent()) {
            final List<String> texts = pages.get().pages();
            for (int i = 0; i < texts.size(); i++) {
                if (!texts.get(i).isBlank()) {
                    chunks.add(chunk(pdf, i + 1, texts.get(i)));
                }
            }
            return chunks;
        }

        textService.cachedText(pdf)
                .filter(text -> !text.isBlank())
                .ifPresent(text -> chunks.add(chunk(pdf, Chunk.WHOLE_DOCUMENT, text)));
        return chunks;
    }

    private static Chunk chunk(final PdfEntity pdf, final int pageNo, final String text) {
        return new Chunk(pdf.getHash(), pageNo, pdf.getDetectedYear(), pdf.getUrl(), pdf.getOriginalName(), text);
    }
}
