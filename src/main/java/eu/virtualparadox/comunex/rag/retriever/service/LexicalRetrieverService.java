package eu.virtualparadox.comunex.rag.retriever.service;

import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.rag.index.IndexService;
import eu.virtualparadox.comunex.rag.index.LexicalIndex;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BM25 retrieval over the live {@link LexicalIndex}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LexicalRetrieverService implements RetrieverService {

    private static final Comparator<SearchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(SearchResult::score).reversed();

    private final IndexService indexService;

    @Override
    public List<SearchResult> search(final String query, final int topK, final Integer yearFilter, final Double minScore) {
        validateTopK(topK);
        return indexService.read(index -> searchIndex(index, query, topK, yearFilter, minScore));
    }

    @Override
    public List<SearchResult> multiQuerySearch(final List<String> queries,
                                               final int topK,
                                               final Integer yearFilter,
                                               final Double minScore) {
        validateTopK(topK);
        return indexService.read(index -> {
            final Map<String, SearchResult> best = new LinkedHashMap<>();
            for (final String query : queries) {
                for (final SearchResult result : searchIndex(index, query, topK, yearFilter, minScore)) {
                    best.merge(result.chunk().key(), result,
                            (kept, candidate) -> candidate.score() > kept.score() ? candidate : kept);
                }
            }
            final List<SearchResult> merged = new ArrayList<>(best.values());
            merged.sort(BY_SCORE_DESC);
            return truncate(merged, topK);
        });
    }

    private List<SearchResult> searchIndex(final LexicalIndex index,
                                           final String query,
                                           final int topK,
                                           final Integer yearFilter,
                                           final Double minScore) {
        if (index.isEmpty() || query == null || query.isBlank()) {
            return List.of();
        }
        final double[] scores = index.score(query);
        final List<Chunk> chunks = index.chunks();

        final List<SearchResult> results = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            final Chunk chunk = chunks.get(i);
            if (yearFilter != null && !Objects.equals(chunk.year(), yearFilter)) {
                continue;
            }
            if (minScore != null && scores[i] < minScore) {
                continue;
            }
            results.add(new SearchResult(chunk, scores[i]));
        }
        // List.sort is stable: equal scores keep index order
        results.sort(BY_SCORE_DESC);
        final List<SearchResult> top = truncate(results, topK);
        log.debug("Query '{}' (year {}): {} of {} chunks kept", query, yearFilter, top.size(), results.size());
        return top;
    }

    private static List<SearchResult> truncate(final List<SearchResult> results, final int topK) {
        return results.size() > topK ? List.copyOf(results.subList(0, topK)) : List.copyOf(results);
    }

    private static void validateTopK(final int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
    }
}
