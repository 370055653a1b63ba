package eu.virtualparadox.comunex.crawl.robots;

import eu.virtualparadox.comunex.application.config.CrawlerConfig;
import eu.virtualparadox.comunex.crawl.fetch.FetchResult;
import eu.virtualparadox.comunex.crawl.fetch.PageFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Loads robots.txt once per crawl. Missing or unreachable files never block the crawl.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RobotsPolicy {

    private final PageFetcher fetcher;
    private final CrawlerConfig config;

    /**
     * Fetches {@code {scheme}://{host}/robots.txt} for the origin of {@code baseUrl}.
     *
     * @param baseUrl any URL on the target site
     * @return parsed rules, or allow-all rules when the file is unavailable
     */
    public RobotsRules load(final String baseUrl) {
        final String robotsUrl;
        try {
            robotsUrl = robotsUrlOf(baseUrl);
        } catch (URISyntaxException e) {
            log.warn("Cannot derive robots.txt location from {}, allowing all", baseUrl);
            return RobotsRules.unloaded(config.getMinDelay());
        }

        final RobotsRules rules = fetchRules(robotsUrl);
        if (!config.isRespectRobots()) {
            log.info("robots.txt access rules disabled by configuration");
            return rules.ignoringAccessRules();
        }
        return rules;
    }

    private RobotsRules fetchRules(final String robotsUrl) {
        try {
            final FetchResult result = fetcher.fetch(robotsUrl, config.getRequestTimeout());
            if (!result.isOk()) {
                log.info("robots.txt returned HTTP {} at {}, allowing all", result.status(), robotsUrl);
                return RobotsRules.unloaded(config.getMinDelay());
            }
            final RobotsRules rules = RobotsRules.parse(result.bodyAsText(), config.getUserAgent(), config.getMinDelay());
            log.info("Loaded robots.txt from {} (crawl delay {} ms, {} sitemaps)",
                    robotsUrl, rules.crawlDelay().toMillis(), rules.sitemapUrls().size());
            return rules;
        } catch (IOException | IllegalArgumentException e) {
            log.info("robots.txt unreachable at {}, allowing all: {}", robotsUrl, e.getMessage());
            return RobotsRules.unloaded(config.getMinDelay());
        }
    }

    static String robotsUrlOf(final String baseUrl) throws URISyntaxException {
        final URI uri = new URI(baseUrl);
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new URISyntaxException(baseUrl, "Absolute URL expected");
        }
        return uri.getScheme() + "://" + uri.getRawAuthority() + "/robots.txt";
    }
}
