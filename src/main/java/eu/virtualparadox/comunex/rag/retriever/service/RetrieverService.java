package eu.virtualparadox.comunex.rag.retriever.service;

import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;

import java.util.List;

public interface RetrieverService {

    /**
     * Scores every chunk against {@code query}, keeps those of {@code yearFilter} (when set)
     * scoring at least {@code minScore} (when set), and returns the best {@code topK} by
     * descending score. Equal scores keep index order.
     */
    List<SearchResult> search(String query, int topK, Integer yearFilter, Double minScore);

    /**
     * Runs {@link #search} per query and merges by (hash, page), keeping each chunk once with
     * its best score across all queries.
     */
    List<SearchResult> multiQuerySearch(List<String> queries, int topK, Integer yearFilter, Double minScore);
}
