package eu.virtualparadox.comunex.crawl.fetch;

import java.io.IOException;
import java.time.Duration;

/**
 * Issues GET requests on behalf of the crawler, the robots policy and the content store.
 * Non-2xx responses are returned, not thrown.
 */
public interface PageFetcher {

    /**
     * @param url     absolute http(s) URL
     * @param timeout wall-clock limit for connecting and reading the response
     * @return the final response after any transient-failure retries
     * @throws IOException              when the server could not be reached
     * @throws IllegalArgumentException when the URL is malformed or not http(s); never retried
     */
    FetchResult fetch(String url, Duration timeout) throws IOException;
}
