package eu.virtualparadox.comunex.catalog.service;

import eu.virtualparadox.comunex.catalog.converter.PathConverter;
import eu.virtualparadox.comunex.catalog.entity.PdfEntity;
import eu.virtualparadox.comunex.catalog.entity.PdfUrlEntity;
import eu.virtualparadox.comunex.catalog.entity.TextEntity;
import eu.virtualparadox.comunex.catalog.entity.ValueCacheEntity;
import eu.virtualparadox.comunex.catalog.repo.PdfRepository;
import eu.virtualparadox.comunex.catalog.repo.PdfUrlRepository;
import eu.virtualparadox.comunex.catalog.repo.TextRepository;
import eu.virtualparadox.comunex.catalog.repo.ValueCacheRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Service layer over the content-addressed catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Recording stored PDFs keyed by content hash, with every URL that served them</li>
 *     <li>Recording extracted text files per content hash</li>
 *     <li>Indexing cached language-model results</li>
 *     <li>Lookups and summary counts for the pipeline stages</li>
 * </ul>
 *
 * <p>Catalog records are append-only: a PDF record is never overwritten; later URLs serving the
 * same bytes are added as aliases.</p>
 */
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private final PdfRepository pdfRepository;
    private final PdfUrlRepository pdfUrlRepository;
    private final TextRepository textRepository;
    private final ValueCacheRepository valueCacheRepository;

    private final PathConverter pathConverter = new PathConverter();

    /**
     * Looks up the PDF that a URL was last seen serving.
     *
     * @param url source URL as fetched
     * @return the catalog record, or empty when the URL was never stored
     */
    @Transactional(readOnly = true)
    public Optional<PdfEntity> findByUrl(final String url) {
        return pdfUrlRepository.findById(url)
                .flatMap(mapping -> pdfRepository.findById(mapping.getHash()));
    }

    @Transactional(readOnly = true)
    public Optional<PdfEntity> findByHash(final String hash) {
        return pdfRepository.findById(hash);
    }

    /**
     * Inserts a new PDF record. The insert is a plain SQL insert so that a concurrent
     * writer with the same hash loses on the primary key.
     *
     * @param pdf the record to insert
     * @throws DataIntegrityViolationException when a record with the same hash already exists
     */
    @Transactional
    public void insert(final PdfEntity pdf) {
        if (pdf.getHash() == null || pdf.getHash().isBlank()) {
            throw new IllegalArgumentException("PDF record requires a content hash");
        }
        if (pdf.getLocalPath() == null) {
            throw new IllegalArgumentException("PDF record requires a local path: " + pdf.getHash());
        }
        final Instant downloadedAt = pdf.getDownloadedAt() != null ? pdf.getDownloadedAt() : Instant.now();
        pdfRepository.insert(
                pdf.getHash(),
                pdf.getUrl(),
                pdf.getOriginalName(),
                pathConverter.convertToDatabaseColumn(pdf.getLocalPath()),
                pdf.getDetectedYear(),
                downloadedAt,
                pdf.getContentType(),
                pdf.getSizeBytes());
    }

    /**
     * Records (or refreshes) the URL to hash mapping.
     */
    @Transactional
    public void recordUrl(final String url, final String hash, final String originalName) {
        final PdfUrlEntity mapping = pdfUrlRepository.findById(url)
                .orElseGet(() -> PdfUrlEntity.builder().url(url).recordedAt(Instant.now()).build());
        mapping.setHash(hash);
        mapping.setOriginalName(originalName);
        pdfUrlRepository.save(mapping);
    }

    /**
     * All URLs known to serve the given content, oldest first.
     */
    @Transactional(readOnly = true)
    public List<String> urlsOf(final String hash) {
        return pdfUrlRepository.findByHashOrderByRecordedAtAsc(hash).stream()
                .map(PdfUrlEntity::getUrl)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PdfEntity> listAll() {
        return pdfRepository.findAll();
    }

    /**
     * Lists the dated documents in the given years, or every dated document when
     * {@code years} is empty. Unknown-year documents are never returned.
     */
    @Transactional(readOnly = true)
    public List<PdfEntity> listByYears(final Collection<Integer> years) {
        if (years == null || years.isEmpty()) {
            return pdfRepository.findByDetectedYearIsNotNull();
        }
        return pdfRepository.findByDetectedYearIn(years);
    }

    @Transactional(readOnly = true)
    public Optional<TextEntity> findText(final String hash) {
        return textRepository.findById(hash);
    }

    /**
     * Records an extracted text. An existing record for the same hash is kept as-is.
     *
     * @return {@code true} when a new record was written
     */
    @Transactional
    public boolean recordText(final TextEntity text) {
        if (textRepository.existsById(text.getHash())) {
            return false;
        }
        textRepository.save(text);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<ValueCacheEntity> findValueCache(final String cacheKey) {
        return valueCacheRepository.findById(cacheKey);
    }

    @Transactional
    public void recordValueCache(final ValueCacheEntity entry) {
        valueCacheRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public CatalogStats stats() {
        return new CatalogStats(
                pdfRepository.count(),
                pdfUrlRepository.count(),
                pdfRepository.countByDetectedYearIsNull(),
                textRepository.count(),
                valueCacheRepository.count());
    }
}
