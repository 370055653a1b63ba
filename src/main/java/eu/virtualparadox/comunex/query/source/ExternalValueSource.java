package eu.virtualparadox.comunex.query.source;

import eu.virtualparadox.comunex.query.QueryPlan;
import eu.virtualparadox.comunex.query.model.SourceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class ExternalValueSource implements IndicatorValueSource {

    private final ObjectProvider<ExternalSource> sources;

    @Override
    public Optional<SourceRecord> resolve(final IndicatorContext context) {
        final QueryPlan plan = context.plan();
        for (final ExternalSource source : sources.orderedStream().toList()) {
            final Optional<ExternalValue> value;
            try {
                value = source.query(context.comune(), plan.indicator(), plan.year());
            } catch (RuntimeException e) {
                log.warn("External source {} failed for '{}' {}: {}", source.name(), plan.indicator(), plan.year(), e.getMessage());
                continue;
            }
            if (value.isPresent()) {
                return Optional.of(new SourceRecord(
                        plan.indicator(),
                        plan.year(),
                        value.get().value(),
                        value.get().reference(),
                        null,
                        null,
                        null,
                        1.0,
                        SourceRecord.METHOD_EXTERNAL_PREFIX + source.name(),
                        null));
            }
        }
        return Optional.empty();
    }
}
