package eu.virtualparadox.comunex.ingest.extractor;

import java.util.List;

/**
 * Raw output of one engine: one entry per page, in page order.
 *
 * @param pages     text of each page, never {@code null} entries
 * @param pageCount number of pages in the document (may exceed {@code pages.size()} when
 *                  only the first pages were requested)
 */
public record PageTexts(List<String> pages, int pageCount) {

    public PageTexts {
        pages = pages.stream().map(p -> p == null ? "" : p).toList();
        if (pageCount < pages.size()) {
            throw new IllegalArgumentException("pageCount " + pageCount + " below extracted pages " + pages.size());
        }
    }

    public String joined() {
        return String.join("\n\n", pages);
    }

    public boolean anyPageHasText() {
        return pages.stream().anyMatch(p -> !p.isBlank());
    }

    public boolean hasText() {
        return !joined().isBlank();
    }
}
