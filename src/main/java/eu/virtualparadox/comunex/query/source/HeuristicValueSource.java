package eu.virtualparadox.comunex.query.source;

import eu.virtualparadox.comunex.application.config.ExtractionConfig;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.query.QueryPlan;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;
import eu.virtualparadox.comunex.value.ExtractionCandidate;
import eu.virtualparadox.comunex.value.HeuristicValueExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Takes the best positively scored candidate of the first retrieved chunks that has one.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class HeuristicValueSource implements IndicatorValueSource {

    private final HeuristicValueExtractor extractor;
    private final ExtractionConfig config;

    @Override
    public Optional<SourceRecord> resolve(final IndicatorContext context) {
        final QueryPlan plan = context.plan();
        final int limit = Math.min(config.getHeuristicDocs(), context.retrieved().size());
        for (final SearchResult result : context.retrieved().subList(0, limit)) {
            final Chunk chunk = result.chunk();
            final List<ExtractionCandidate> candidates = extractor.extract(
                    chunk.text(), plan.keywords(), plan.expectedRange(), plan.year(), config.getHeuristicTopK());
            if (!candidates.isEmpty() && candidates.get(0).score() > 0) {
                final ExtractionCandidate best = candidates.get(0);
                return Optional.of(new SourceRecord(
                        plan.indicator(),
                        plan.year(),
                        best.value(),
                        chunk.url(),
                        chunk.filename(),
                        chunk.pageNo(),
                        best.snippet(),
                        Math.min(1.0, best.score() / config.getConfidenceDivisor()),
                        SourceRecord.METHOD_HEURISTIC,
                        chunk.hash()));
            }
        }
        return Optional.empty();
    }
}
