package eu.virtualparadox.comunex.query.source;

import eu.virtualparadox.comunex.application.config.LlmConfig;
import eu.virtualparadox.comunex.ingest.model.Chunk;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import eu.virtualparadox.comunex.rag.retriever.model.SearchResult;
import eu.virtualparadox.comunex.value.llm.LlmValue;
import eu.virtualparadox.comunex.value.llm.LlmValueExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(1)
@RequiredArgsConstructor
public class LlmValueSource implements IndicatorValueSource {

    private final LlmValueExtractor extractor;
    private final LlmConfig config;

    @Override
    public Optional<SourceRecord> resolve(final IndicatorContext context) {
        if (!extractor.isAvailable()) {
            return Optional.empty();
        }
        final int limit = Math.min(config.getMaxDocs(), context.retrieved().size());
        for (final SearchResult result : context.retrieved().subList(0, limit)) {
            final Chunk chunk = result.chunk();
            final Optional<LlmValue> answer = extractor.extract(chunk.text(), context.plan().indicator(), context.plan().year());
            if (answer.isPresent()) {
                return Optional.of(new SourceRecord(
                        context.plan().indicator(),
                        context.plan().year(),
                        answer.get().value(),
                        chunk.url(),
                        chunk.filename(),
                        chunk.pageNo(),
                        answer.get().evidence(),
                        answer.get().confidence(),
                        SourceRecord.METHOD_LLM,
                        chunk.hash()));
            }
        }
        return Optional.empty();
    }
}
