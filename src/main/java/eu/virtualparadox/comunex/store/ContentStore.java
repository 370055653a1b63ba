package eu.virtualparadox.comunex.store;

import eu.virtualparadox.comunex.application.config.CrawlerConfig;
import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import eu.virtualparadox.comunex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.comunex.crawl.CrawlUrls;
import eu.virtualparadox.comunex.crawl.fetch.FetchResult;
import eu.virtualparadox.comunex.crawl.fetch.PageFetcher;
import eu.virtualparadox.comunex.store.year.YearResolver;
import eu.virtualparadox.comunex.util.ContentHashes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Content-addressed PDF store.
 * <p>
 * Every PDF is identified by the SHA-1 of its bytes and stored once under
 * {@code {root}/{comune}/{year|unknown}/pdf/}. Calls for the same URL are serialized;
 * calls for different URLs serving identical bytes are resolved by the catalog's primary key,
 * so at most one record exists per hash and the losing caller reports
 * {@link EStoreOutcome#DEDUPLICATED}.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentStore {

    private static final String TEMP_FILE_PREFIX = "dl-";
    private static final String TEMP_FILE_SUFFIX = ".tmp";
    private static final String PDF_EXTENSION = ".pdf";
    private static final String DEFAULT_NAME = "document.pdf";

    private final PageFetcher fetcher;
    private final DocumentCatalogService catalog;
    private final YearResolver yearResolver;
    private final WorkspaceLayout layout;
    private final CrawlerConfig config;

    /** Locks of the URLs currently being stored; an entry lives while it has holders. */
    private final ConcurrentMap<String, UrlLock> urlLocks = new ConcurrentHashMap<>();

    /**
     * Stores the PDF served at {@code url}.
     *
     * @param url absolute PDF URL
     * @return what happened; only catalog failures escape as exceptions
     */
    public EStoreOutcome store(final String url) {
        final UrlLock lock = urlLocks.compute(url, (k, existing) -> (existing == null ? new UrlLock() : existing).acquire());
        try {
            synchronized (lock) {
                return storeLocked(url);
            }
        } finally {
            urlLocks.computeIfPresent(url, (k, existing) -> existing.release() ? null : existing);
        }
    }

    /**
     * Number of URLs with a lock entry, that is URLs being stored right now.
     */
    int lockedUrls() {
        return urlLocks.size();
    }

    private EStoreOutcome storeLocked(final String url) {
        final Optional<PdfEntity> known = catalog.findByUrl(url);
        if (known.isPresent() && Files.exists(known.get().getLocalPath())) {
            log.debug("Cached {}", url);
            return EStoreOutcome.CACHED;
        }

        final FetchResult response;
        try {
            response = fetcher.fetch(url, config.getDownloadTimeout());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Download failed for {}: {}", url, e.getMessage());
            return EStoreOutcome.FAILED;
        }
        if (!response.isOk()) {
            log.warn("Download failed for {}: HTTP {}", url, response.status());
            return EStoreOutcome.FAILED;
        }
        if (!response.normalizedContentType().contains("pdf") && !CrawlUrls.isPdfUrl(url)) {
            log.warn("Not a PDF: {} ({})", url, response.contentType());
            return EStoreOutcome.FAILED;
        }

        final String originalName = originalName(url);
        Path temp = null;
        try {
            Files.createDirectories(layout.tempDir());
            temp = Files.createTempFile(layout.tempDir(), TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            Files.write(temp, response.body());
            final String hash = ContentHashes.sha1(temp);

            final Optional<PdfEntity> sameContent = catalog.findByHash(hash);
            if (sameContent.isPresent()) {
                return reuseExisting(url, originalName, temp, sameContent.get());
            }

            final Integer year = yearResolver.resolve(url, originalName, temp);
            final Path target = layout.pdfDir(year).resolve(WorkspaceLayout.storedFileName(hash, originalName));
            Files.createDirectories(target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            temp = null;

            final PdfEntity record = PdfEntity.builder()
                    .hash(hash)
                    .url(url)
                    .originalName(originalName)
                    .localPath(target)
                    .detectedYear(year)
                    .downloadedAt(Instant.now())
                    .contentType(response.contentType())
                    .sizeBytes(response.body().length)
                    .build();
            try {
                catalog.insert(record);
            } catch (DataIntegrityViolationException e) {
                return loseInsertRace(url, originalName, hash, target);
            }
            catalog.recordUrl(url, hash, originalName);
            log.info("Downloaded {} -> {} (year {})", url, target.getFileName(), year == null ? WorkspaceLayout.UNKNOWN_YEAR : year);
            return EStoreOutcome.DOWNLOADED;
        } catch (IOException e) {
            log.warn("Could not store {}: {}", url, e.getMessage());
            return EStoreOutcome.FAILED;
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Content already stored under another URL. The bytes are dropped unless the stored file
     * went missing, in which case they restore it.
     */
    private EStoreOutcome reuseExisting(final String url,
                                        final String originalName,
                                        final Path temp,
                                        final PdfEntity existing) throws IOException {
        if (!Files.exists(existing.getLocalPath())) {
            Files.createDirectories(existing.getLocalPath().getParent());
            Files.move(temp, existing.getLocalPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Restored missing file {} from {}", existing.getLocalPath().getFileName(), url);
        }
        catalog.recordUrl(url, existing.getHash(), originalName);
        if (url.equals(existing.getUrl())) {
            return EStoreOutcome.DOWNLOADED;
        }
        log.info("Duplicate content {} already stored as {}", url, existing.getLocalPath().getFileName());
        return EStoreOutcome.DEDUPLICATED;
    }

    /**
     * Another worker inserted the same hash first: keep its file and record this URL as an alias.
     */
    private EStoreOutcome loseInsertRace(final String url, final String originalName, final String hash, final Path ours) throws IOException {
        final PdfEntity winner = catalog.findByHash(hash)
                .orElseThrow(() -> new IllegalStateException("Catalog rejected " + hash + " but holds no record for it"));
        if (!winner.getLocalPath().normalize().equals(ours.normalize())) {
            Files.deleteIfExists(ours);
        }
        catalog.recordUrl(url, hash, originalName);
        log.info("Duplicate content {} stored concurrently as {}", url, winner.getLocalPath().getFileName());
        return EStoreOutcome.DEDUPLICATED;
    }

    /**
     * Last URL path segment without query string, with {@code .pdf} appended when missing.
     */
    static String originalName(final String url) {
        String name = CrawlUrls.lastSegment(url);
        if (name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (!name.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
            name = name + PDF_EXTENSION;
        }
        return name;
    }

    /**
     * Per-URL monitor counting its holders. The count is only touched inside
     * {@link ConcurrentMap#compute} for the URL's key.
     */
    private static final class UrlLock {

        private int holders;

        UrlLock acquire() {
            holders++;
            return this;
        }

        /**
         * @return {@code true} when the last holder left
         */
        boolean release() {
            return --holders == 0;
        }
    }

    private static void deleteQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", temp, e);
        }
    }
}
