package eu.virtualparadox.comunex.query.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of {@code sources.json}: where the value of an indicator for a year came from.
 *
 * @param indicator  indicator name
 * @param year       target year
 * @param value      resolved value, {@code null} when not found
 * @param url        source URL of the document
 * @param filename   original file name of the document
 * @param pageNo     page the value was read from, 0 for whole-document text
 * @param snippet    text around the value
 * @param confidence 0..1
 * @param method     how the value was obtained
 * @param docId      content hash of the document
 */
public record SourceRecord(@JsonProperty("indicator") String indicator,
                           @JsonProperty("year") int year,
                           @JsonProperty("value") Double value,
                           @JsonProperty("url") String url,
                           @JsonProperty("filename") String filename,
                           @JsonProperty("page_no") Integer pageNo,
                           @JsonProperty("snippet") String snippet,
                           @JsonProperty("confidence") double confidence,
                           @JsonProperty("method") String method,
                           @JsonProperty("doc_id") String docId) {

    public static final String METHOD_LLM = "llm";
    public static final String METHOD_HEURISTIC = "heuristic";
    public static final String METHOD_EXTERNAL_PREFIX = "external_";
    public static final String METHOD_NOT_FOUND = "NOT_FOUND";

    public static SourceRecord notFound(final String indicator, final int year) {
        return new SourceRecord(indicator, year, null, null, null, null, null, 0.0, METHOD_NOT_FOUND, null);
    }

    @JsonIgnore
    public boolean isFound() {
        return value != null;
    }
}
