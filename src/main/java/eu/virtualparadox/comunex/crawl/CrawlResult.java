package eu.virtualparadox.comunex.crawl;

import java.util.List;

/**
 * @param pdfUrls      discovered PDF URLs in discovery order, at most the configured PDF cap
 * @param htmlUrls     every HTML page seen, uncapped
 * @param pagesVisited URLs taken from the queue and counted against the page cap
 */
public record CrawlResult(List<String> pdfUrls, List<String> htmlUrls, int pagesVisited) {

    public CrawlResult {
        pdfUrls = List.copyOf(pdfUrls);
        htmlUrls = List.copyOf(htmlUrls);
    }
}
