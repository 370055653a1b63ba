package eu.virtualparadox.comunex.ingest.extractor;

/**
 * @param text      whole-document text, pages joined by a blank line
 * @param pageCount pages in the document
 * @param engine    engine whose output was accepted
 */
public record ExtractedText(String text, int pageCount, String engine) {
}
