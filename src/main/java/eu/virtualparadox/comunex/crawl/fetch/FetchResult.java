package eu.virtualparadox.comunex.crawl.fetch;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Outcome of a single GET that reached the server. Transport failures are reported as
 * {@link java.io.IOException} instead.
 *
 * @param url         requested URL
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header, may be {@code null}
 * @param body        raw response body, never {@code null}
 * @param charset     declared charset, may be {@code null}
 */
public record FetchResult(String url, int status, String contentType, byte[] body, String charset) {

    public FetchResult {
        if (body == null) {
            body = new byte[0];
        }
    }

    public boolean isOk() {
        return status == 200;
    }

    /**
     * Lower-cased content type, or an empty string when the header was absent.
     */
    public String normalizedContentType() {
        return contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    }

    public String bodyAsText() {
        Charset cs = StandardCharsets.UTF_8;
        if (charset != null && Charset.isSupported(charset)) {
            cs = Charset.forName(charset);
        }
        return new String(body, cs);
    }
}
