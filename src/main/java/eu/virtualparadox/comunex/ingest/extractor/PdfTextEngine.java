package eu.virtualparadox.comunex.ingest.extractor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One way of turning a PDF into per-page text.
 */
public interface PdfTextEngine {

    /** Name recorded in the text catalog. */
    String name();

    /**
     * @param pdf      PDF on disk
     * @param maxPages number of leading pages to extract; {@code 0} or less means all pages
     */
    PageTexts extractPages(Path pdf, int maxPages) throws IOException;
}
