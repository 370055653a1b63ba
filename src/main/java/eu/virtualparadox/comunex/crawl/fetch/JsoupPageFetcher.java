package eu.virtualparadox.comunex.crawl.fetch;

import eu.virtualparadox.comunex.application.config.CrawlerConfig;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * {@link PageFetcher} backed by Jsoup's HTTP connection. Transient failures are retried
 * through the shared resilience4j {@link Retry}; malformed URLs are rejected before any
 * attempt is made.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsoupPageFetcher implements PageFetcher {

    private final CrawlerConfig config;
    private final Retry httpRetry;

    @Override
    public FetchResult fetch(final String url, final Duration timeout) throws IOException {
        validate(url);
        final Callable<FetchResult> call = Retry.decorateCallable(httpRetry, () -> execute(url, timeout));
        try {
            return call.call();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("GET failed for " + url, e);
        }
    }

    private FetchResult execute(final String url, final Duration timeout) throws IOException {
        log.debug("GET {}", url);
        final Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .method(Connection.Method.GET)
                    .userAgent(config.getUserAgent())
                    .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .execute();
        } catch (IllegalArgumentException e) {
            // Jsoup may still reject a URL after redirects
            throw new IOException("Invalid URL: " + url, e);
        }
        return new FetchResult(url, response.statusCode(), response.contentType(), response.bodyAsBytes(), response.charset());
    }

    /**
     * Accepts absolute http(s) URLs with a host; anything else would fail on every attempt.
     */
    static void validate(final String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
        final URL parsed;
        try {
            parsed = new URL(url);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
        final String protocol = parsed.getProtocol().toLowerCase(Locale.ROOT);
        if (!"http".equals(protocol) && !"https".equals(protocol)) {
            throw new IllegalArgumentException("Not an http(s) URL: " + url);
        }
        if (parsed.getHost() == null || parsed.getHost().isEmpty()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
    }
}
