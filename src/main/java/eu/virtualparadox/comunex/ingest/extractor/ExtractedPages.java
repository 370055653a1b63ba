package eu.virtualparadox.comunex.ingest.extractor;

import java.util.List;

/**
 * @param pages     text per page; index {@code i} holds page {@code i + 1}
 * @param pageCount pages in the document
 * @param engine    engine whose output was accepted
 */
public record ExtractedPages(List<String> pages, int pageCount, String engine) {

    public ExtractedPages {
        pages = List.copyOf(pages);
    }

    public String joined() {
        return String.join("\n\n", pages);
    }
}
