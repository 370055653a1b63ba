package eu.virtualparadox.comunex.query.source;

import eu.virtualparadox.comunex.query.QueryPlan;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;

import java.util.List;

/**
 * @param comune    municipality being processed
 * @param plan      queries and keywords for the indicator and year
 * @param retrieved chunks retrieved for the plan, best first
 */
public record IndicatorContext(String comune, QueryPlan plan, List<SearchResult> retrieved) {

    public IndicatorContext {
        retrieved = List.copyOf(retrieved);
    }
}
