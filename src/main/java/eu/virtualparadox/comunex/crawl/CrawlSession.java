package eu.virtualparadox.comunex.crawl;

import eu.virtualparadox.comunex.crawl.robots.RobotsRules;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Mutable state of one crawl run. A fresh session is created per run and owned by a single
 * thread, so nothing here is synchronized.
 */
public class CrawlSession {

    @Getter
    private final String baseUrl;
    @Getter
    private final String baseHost;
    @Getter
    private final RobotsRules rules;
    private final int maxPages;
    private final int maxPdfs;

    @Getter
    private ECrawlState state = ECrawlState.SEEDING;

    private final Queue<String> frontier = new ArrayDeque<>();
    private final Set<String> enqueued = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final Set<String> seeded = new HashSet<>();
    private final Set<String> sitemapsSeen = new HashSet<>();
    private final Set<String> pdfUrls = new LinkedHashSet<>();
    private final Set<String> htmlUrls = new LinkedHashSet<>();

    private long lastRequestNanos = -1;

    public CrawlSession(final String baseUrl, final RobotsRules rules, final int maxPages, final int maxPdfs) {
        if (maxPages < 0 || maxPdfs < 0) {
            throw new IllegalArgumentException("Crawl caps must not be negative");
        }
        this.baseUrl = CrawlUrls.normalize(baseUrl);
        this.baseHost = CrawlUrls.siteHost(this.baseUrl)
                .orElseThrow(() -> new IllegalArgumentException("Base URL has no host: " + baseUrl));
        this.rules = rules;
        this.maxPages = maxPages;
        this.maxPdfs = maxPdfs;
    }

    public void startCrawling() {
        if (state != ECrawlState.SEEDING) {
            throw new IllegalStateException("Crawl can only start after seeding, current state " + state);
        }
        state = ECrawlState.CRAWLING;
    }

    public void finish() {
        state = ECrawlState.DONE;
    }

    public boolean pageCapReached() {
        return visited.size() >= maxPages;
    }

    public boolean pdfCapReached() {
        return pdfUrls.size() >= maxPdfs;
    }

    public boolean capsReached() {
        return pageCapReached() || pdfCapReached();
    }

    /**
     * @return {@code false} if the sitemap was already processed in this run
     */
    public boolean markSitemapSeen(final String sitemapUrl) {
        return sitemapsSeen.add(sitemapUrl);
    }

    /**
     * @return {@code false} if the URL was already listed by a sitemap in this run
     */
    public boolean markSeeded(final String url) {
        return seeded.add(url);
    }

    public boolean addPdf(final String url) {
        if (pdfCapReached()) {
            return false;
        }
        return pdfUrls.add(url);
    }

    public void addHtml(final String url) {
        htmlUrls.add(url);
    }

    /**
     * Queues a URL for breadth-first traversal unless it was already visited or queued.
     */
    public boolean enqueue(final String url) {
        if (visited.contains(url) || !enqueued.add(url)) {
            return false;
        }
        return frontier.add(url);
    }

    /**
     * Next queued URL, or {@code null} when the queue is drained.
     */
    public String poll() {
        return frontier.poll();
    }

    public boolean isVisited(final String url) {
        return visited.contains(url);
    }

    public void markVisited(final String url) {
        visited.add(url);
    }

    public int pagesVisited() {
        return visited.size();
    }

    /**
     * Blocks until the politeness delay since the previous request has elapsed, then records
     * the new request time.
     *
     * @return {@code false} if the thread was interrupted while waiting
     */
    public boolean awaitPoliteness() {
        final Duration delay = rules.crawlDelay();
        if (lastRequestNanos >= 0 && !delay.isZero()) {
            final long waitNanos = delay.toNanos() - (System.nanoTime() - lastRequestNanos);
            if (waitNanos > 0) {
                try {
                    Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        lastRequestNanos = System.nanoTime();
        return true;
    }

    public CrawlResult result() {
        return new CrawlResult(pdfUrls.stream().toList(), htmlUrls.stream().toList(), visited.size());
    }
}
