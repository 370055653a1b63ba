package eu.virtualparadox.comunex.store.year;

import java.nio.file.Path;

/**
 * What is known about a document when its year is being decided.
 *
 * @param url      source URL
 * @param filename original file name
 * @param document the downloaded file, may be {@code null} when only names are available
 */
public record YearEvidence(String url, String filename, Path document) {
}
