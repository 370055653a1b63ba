package eu.virtualparadox.comunex.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Unit of retrieval: one page of a stored PDF, or the whole document when {@code pageNo} is 0.
 *
 * @param hash     content hash of the parent PDF
 * @param pageNo   1-based page number, or 0 for a whole-document chunk
 * @param year     detected year of the parent PDF, {@code null} when unknown
 * @param url      primary source URL
 * @param filename original file name
 * @param text     chunk text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chunk(String hash, int pageNo, Integer year, String url, String filename, String text) {

    public static final int WHOLE_DOCUMENT = 0;

    public Chunk {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Chunk requires the parent content hash");
        }
        if (pageNo < 0) {
            throw new IllegalArgumentException("Chunk page number must not be negative: " + pageNo);
        }
        if (text == null) {
            throw new IllegalArgumentException("Chunk text must not be null");
        }
    }

    /** Identity of the chunk across queries: parent hash and page. */
    public String key() {
        return hash + "#" + pageNo;
    }
}
