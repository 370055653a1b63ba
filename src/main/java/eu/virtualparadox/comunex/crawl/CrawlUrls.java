package eu.virtualparadox.comunex.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL helpers shared by the crawler and the content store.
 */
public final class CrawlUrls {

    private static final String WWW_PREFIX = "www.";

    private CrawlUrls() {
    }

    /**
     * Drops the fragment; two links differing only by {@code #anchor} are the same page.
     */
    public static String normalize(final String url) {
        if (url == null) {
            return "";
        }
        final int hash = url.indexOf('#');
        return (hash >= 0 ? url.substring(0, hash) : url).trim();
    }

    /**
     * Lower-cased host without a leading {@code www.}.
     */
    public static Optional<String> siteHost(final String url) {
        try {
            final String host = new URI(url).getHost();
            if (host == null) {
                return Optional.empty();
            }
            final String lower = host.toLowerCase(Locale.ROOT);
            return Optional.of(lower.startsWith(WWW_PREFIX) ? lower.substring(WWW_PREFIX.length()) : lower);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * True when {@code url} is on the same site as {@code baseHost} or one of its subdomains.
     */
    public static boolean isSameSite(final String url, final String baseHost) {
        return siteHost(url)
                .map(host -> host.equals(baseHost) || host.endsWith("." + baseHost))
                .orElse(false);
    }

    public static boolean isHttp(final String url) {
        final String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Path without query or fragment ends in {@code .pdf}, case-insensitively.
     */
    public static boolean isPdfUrl(final String url) {
        return pathOf(url).toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    /**
     * Last path segment without query string, or an empty string when the path ends in a slash.
     */
    public static String lastSegment(final String url) {
        final String path = pathOf(url);
        final int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String pathOf(final String url) {
        String value = normalize(url);
        final int query = value.indexOf('?');
        if (query >= 0) {
            value = value.substring(0, query);
        }
        final int scheme = value.indexOf("://");
        if (scheme >= 0) {
            final int pathStart = value.indexOf('/', scheme + 3);
            value = pathStart >= 0 ? value.substring(pathStart) : "";
        }
        return value;
    }
}
