package eu.virtualparadox.comunex.rag.retriever.model;

import eu.virtualparadox.comunex.ingest.model.Chunk;

/**
 * @param chunk the matching chunk
 * @param score BM25 score (higher = better)
 */
public record SearchResult(Chunk chunk, double score) {

}
