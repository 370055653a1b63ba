package eu.virtualparadox.comunex.ingest.lifecycle;

import eu.virtualparadox.comunex.application.executor.DownloadExecutor;
import eu.virtualparadox.comunex.application.executor.ExtractionExecutor;
import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.ingest.DocumentTextService;
import eu.virtualparadox.comunex.ingest.extractor.ExtractedPages;
import eu.virtualparadox.comunex.ingest.extractor.TextExtractionException;
import eu.virtualparadox.comunex.store.ContentStore;
import eu.virtualparadox.comunex.store.EStoreOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs the two parallel stages of a pipeline run:
 * <ul>
 *   <li>downloading discovered PDFs into the content store, on the {@link DownloadExecutor}</li>
 *   <li>extracting text of stored PDFs, on the {@link ExtractionExecutor}</li>
 * </ul>
 * Each document is handled by exactly one worker. Per-document failures are counted and
 * skipped; only unrecoverable errors (such as an unwritable catalog) abort the stage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    public static final String STAGE_DOWNLOAD = "download";
    public static final String STAGE_EXTRACT = "extract";

    private final ContentStore contentStore;
    private final DocumentTextService textService;
    private final DocumentCatalogService catalogService;
    private final DownloadExecutor downloadExecutor;
    private final ExtractionExecutor extractionExecutor;

    public StageStats downloadAll(final List<String> pdfUrls) {
        final StageTracker tracker = new StageTracker(STAGE_DOWNLOAD);
        log.info("Downloading {} PDFs", pdfUrls.size());

        runAll(downloadExecutor, pdfUrls, url -> {
            tracker.attempted();
            final EStoreOutcome outcome = contentStore.store(url);
            switch (outcome) {
                case DOWNLOADED -> tracker.succeeded();
                case CACHED -> tracker.cached();
                case DEDUPLICATED -> tracker.deduplicated();
                case FAILED -> tracker.failed();
            }
        });

        final StageStats stats = tracker.toStats();
        log.info("Download stage: {}", stats);
        return stats;
    }

    /**
     * Extracts per-page text for every stored PDF, reusing cached text where present.
     */
    public StageStats extractAll() {
        final List<PdfEntity> documents = catalogService.listAll();
        final StageTracker tracker = new StageTracker(STAGE_EXTRACT);
        log.info("Extracting text from {} PDFs", documents.size());

        runAll(extractionExecutor, documents, pdf -> {
            tracker.attempted();
            try {
                final DocumentTextService.TextResult<ExtractedPages> result = textService.pages(pdf);
                if (result.fromCache()) {
                    tracker.cached();
                } else {
                    log.debug("Extracted {} pages from {} with {}",
                            result.value().pageCount(), pdf.getOriginalName(), result.value().engine());
                    tracker.succeeded();
                }
            } catch (TextExtractionException e) {
                log.warn("Text extraction failed for {} ({}): {}", pdf.getOriginalName(), pdf.getHash(), e.getMessage());
                tracker.failed();
            }
        });

        final StageStats stats = tracker.toStats();
        log.info("Extract stage: {}", stats);
        return stats;
    }

    private <T> void runAll(final AsyncTaskExecutor executor, final List<T> items, final Consumer<T> task) {
        final List<Future<?>> futures = new ArrayList<>(items.size());
        for (final T item : items) {
            futures.add(executor.submit(() -> task.accept(item)));
        }
        for (final Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for workers", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Worker failed unrecoverably", e.getCause());
            }
        }
    }
}
