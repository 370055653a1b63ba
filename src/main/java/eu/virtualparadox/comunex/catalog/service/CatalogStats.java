package eu.virtualparadox.comunex.catalog.service;

/**
 * @param pdfs         distinct stored PDFs
 * @param urls         source URLs mapped to a stored PDF (primary URLs and aliases)
 * @param unknownYear  stored PDFs without a detected year
 * @param texts        PDFs with extracted text
 * @param valueCache   cached language-model results
 */
public record CatalogStats(long pdfs, long urls, long unknownYear, long texts, long valueCache) {
}
