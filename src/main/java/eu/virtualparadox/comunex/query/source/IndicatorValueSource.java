package eu.virtualparadox.comunex.query.source;

import eu.virtualparadox.comunex.query.model.SourceRecord;

import java.util.Optional;

/**
 * One stage of indicator resolution. Stages are tried in {@link org.springframework.core.annotation.Order}
 * and the first one returning a record wins.
 */
public interface IndicatorValueSource {

    Optional<SourceRecord> resolve(IndicatorContext context);
}
