package eu.virtualparadox.comunex.crawl;

import eu.virtualparadox.comunex.application.config.CrawlerConfig;
import eu.virtualparadox.comunex.crawl.fetch.FetchResult;
import eu.virtualparadox.comunex.crawl.fetch.PageFetcher;
import eu.virtualparadox.comunex.crawl.robots.RobotsRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Discovers PDF and HTML URLs of one site.
 * <p>
 * A run goes through {@link ECrawlState#SEEDING} (sitemaps listed in robots.txt, followed
 * recursively, no politeness delay) and then, unless a cap was already hit,
 * {@link ECrawlState#CRAWLING}: a breadth-first traversal from the base URL restricted to
 * the same site, honouring robots rules and the crawl delay between page requests.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Crawler {

    private final PageFetcher fetcher;
    private final CrawlerConfig config;

    public CrawlResult crawl(final String baseUrl, final RobotsRules rules) {
        final CrawlSession session = new CrawlSession(baseUrl, rules, config.getMaxPages(), config.getMaxPdfs());
        log.info("Crawling {} (max {} pages, max {} PDFs, delay {} ms)",
                session.getBaseUrl(), config.getMaxPages(), config.getMaxPdfs(), rules.crawlDelay().toMillis());

        session.enqueue(session.getBaseUrl());
        for (final String sitemap : rules.sitemapUrls()) {
            seedFromSitemap(session, sitemap);
        }
        log.info("Seeding done: {} PDFs from sitemaps", session.result().pdfUrls().size());

        if (!session.capsReached()) {
            session.startCrawling();
            crawlBreadthFirst(session);
        }
        session.finish();

        final CrawlResult result = session.result();
        log.info("Crawl finished: {} pages visited, {} PDFs, {} HTML pages",
                result.pagesVisited(), result.pdfUrls().size(), result.htmlUrls().size());
        return result;
    }

    private void seedFromSitemap(final CrawlSession session, final String sitemapUrl) {
        if (session.pdfCapReached() || !session.markSitemapSeen(sitemapUrl)) {
            return;
        }
        final FetchResult result;
        try {
            result = fetcher.fetch(sitemapUrl, config.getRequestTimeout());
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Sitemap unreachable {}: {}", sitemapUrl, e.getMessage());
            return;
        }
        if (!result.isOk()) {
            log.debug("Sitemap {} returned HTTP {}", sitemapUrl, result.status());
            return;
        }

        final Document xml = Jsoup.parse(result.bodyAsText(), sitemapUrl, Parser.xmlParser());
        for (final Element loc : xml.select("sitemap > loc")) {
            seedFromSitemap(session, loc.text().trim());
        }
        for (final Element loc : xml.select("url > loc")) {
            if (session.pdfCapReached()) {
                return;
            }
            classifySeed(session, CrawlUrls.normalize(loc.text()));
        }
    }

    private void classifySeed(final CrawlSession session, final String url) {
        if (url.isEmpty() || !CrawlUrls.isHttp(url) || !session.markSeeded(url)) {
            return;
        }
        if (CrawlUrls.isPdfUrl(url)) {
            if (session.getRules().canFetch(url)) {
                session.addPdf(url);
            }
        } else if (CrawlUrls.isSameSite(url, session.getBaseHost())) {
            session.addHtml(url);
            session.enqueue(url);
        }
    }

    private void crawlBreadthFirst(final CrawlSession session) {
        final RobotsRules rules = session.getRules();
        while (!session.capsReached()) {
            final String url = session.poll();
            if (url == null) {
                break;
            }
            if (session.isVisited(url) || !CrawlUrls.isSameSite(url, session.getBaseHost()) || !rules.canFetch(url)) {
                continue;
            }
            session.markVisited(url);

            if (CrawlUrls.isPdfUrl(url)) {
                session.addPdf(url);
                continue;
            }
            if (!session.awaitPoliteness()) {
                log.warn("Crawl interrupted after {} pages", session.pagesVisited());
                break;
            }
            visitPage(session, url);
        }
    }

    private void visitPage(final CrawlSession session, final String url) {
        final FetchResult result;
        try {
            result = fetcher.fetch(url, config.getRequestTimeout());
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Unreachable {}: {}", url, e.getMessage());
            return;
        }
        if (!result.isOk()) {
            log.debug("Skipping {} (HTTP {})", url, result.status());
            return;
        }

        final String contentType = result.normalizedContentType();
        if (contentType.contains("pdf")) {
            session.addPdf(url);
            return;
        }
        if (!contentType.contains("html")) {
            return;
        }

        session.addHtml(url);
        final Document page = Jsoup.parse(result.bodyAsText(), url);
        for (final Element link : page.select("a[href]")) {
            final String target = CrawlUrls.normalize(link.absUrl("href"));
            if (!target.isEmpty()
                    && CrawlUrls.isHttp(target)
                    && CrawlUrls.isSameSite(target, session.getBaseHost())) {
                session.enqueue(target);
            }
        }
    }
}
