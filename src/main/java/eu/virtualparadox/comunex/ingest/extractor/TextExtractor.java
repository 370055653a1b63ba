package eu.virtualparadox.comunex.ingest.extractor;

import java.nio.file.Path;

/**
 * Extracts text from stored PDFs.
 */
public interface TextExtractor {

    /**
     * @throws TextExtractionException when no engine could read the document
     */
    ExtractedText extract(Path pdf);

    /**
     * Same contract as {@link #extract(Path)} but keeps page boundaries.
     *
     * @throws TextExtractionException when no engine could read the document
     */
    ExtractedPages extractPerPage(Path pdf);

    /**
     * Text of the first {@code pages} pages, or an empty string when nothing could be read.
     */
    String firstPages(Path pdf, int pages);
}
