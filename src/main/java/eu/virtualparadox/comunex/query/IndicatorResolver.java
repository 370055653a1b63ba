package eu.virtualparadox.comunex.query;

import eu.virtualparadox.comunex.application.config.RetrievalConfig;
import eu.virtualparadox.comunex.query.model.QueryRecord;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import eu.virtualparadox.comunex.query.source.IndicatorContext;
import eu.virtualparadox.comunex.query.source.IndicatorValueSource;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;
import eu.virtualparadox.comunex.rag.retriever.service.RetrieverService;
import eu.virtualparadox.comunex.store.WorkspaceLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves one indicator for one year: retrieves chunks of that year with the planned
 * queries, then asks each {@link IndicatorValueSource} in order until one returns a value.
 */
@Service
@Slf4j
public class IndicatorResolver {

    private final QueryBuilder queryBuilder;
    private final RetrieverService retriever;
    private final RetrievalConfig retrievalConfig;
    private final List<IndicatorValueSource> sources;
    private final String comune;

    @Autowired
    public IndicatorResolver(final QueryBuilder queryBuilder,
                             final RetrieverService retriever,
                             final RetrievalConfig retrievalConfig,
                             final ObjectProvider<IndicatorValueSource> sources,
                             final WorkspaceLayout layout) {
        this(queryBuilder, retriever, retrievalConfig, sources.orderedStream().toList(), layout.comune());
    }

    IndicatorResolver(final QueryBuilder queryBuilder,
                      final RetrieverService retriever,
                      final RetrievalConfig retrievalConfig,
                      final List<IndicatorValueSource> sources,
                      final String comune) {
        this.queryBuilder = queryBuilder;
        this.retriever = retriever;
        this.retrievalConfig = retrievalConfig;
        this.sources = List.copyOf(sources);
        this.comune = comune;
    }

    public Resolution resolve(final IndicatorRequest request, final int year) {
        final QueryPlan plan = queryBuilder.plan(request, year);
        final QueryRecord queries = new QueryRecord(plan.indicator(), plan.category(), year,
                plan.queries().get(0), plan.queries().size() > 1 ? plan.queries().get(1) : null);

        final Double minScore = retrievalConfig.getMinScore() > 0 ? retrievalConfig.getMinScore() : null;
        final List<SearchResult> retrieved = retriever.multiQuerySearch(plan.queries(), retrievalConfig.getTopK(), year, minScore);
        final IndicatorContext context = new IndicatorContext(comune, plan, retrieved);

        for (final IndicatorValueSource source : sources) {
            final Optional<SourceRecord> record = source.resolve(context);
            if (record.isPresent()) {
                log.info("{} {} = {} ({}, confidence {})", plan.indicator(), year,
                        record.get().value(), record.get().method(), String.format("%.2f", record.get().confidence()));
                return new Resolution(queries, record.get());
            }
        }
        log.info("{} {}: not found in {} retrieved chunks", plan.indicator(), year, retrieved.size());
        return new Resolution(queries, SourceRecord.notFound(plan.indicator(), year));
    }

    public record Resolution(QueryRecord queries, SourceRecord source) {
    }
}
