package eu.virtualparadox.comunex.query;

import eu.virtualparadox.comunex.value.ValueRange;

import java.util.List;

/**
 * Everything needed to look up one indicator for one year.
 *
 * @param indicator     indicator name without category prefix
 * @param category      category label
 * @param year          target year
 * @param queries       one or two retrieval queries, canonical first
 * @param keywords      keywords for heuristic extraction
 * @param expectedRange plausible value range, may be {@code null}
 */
public record QueryPlan(String indicator,
                        String category,
                        int year,
                        List<String> queries,
                        List<String> keywords,
                        ValueRange expectedRange) {

    public QueryPlan {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("A query plan needs at least one query");
        }
        queries = List.copyOf(queries);
        keywords = List.copyOf(keywords);
    }
}
