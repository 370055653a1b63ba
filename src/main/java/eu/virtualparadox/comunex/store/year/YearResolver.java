package eu.virtualparadox.comunex.store.year;

import eu.virtualparadox.comunex.ingest.extractor.TextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Assigns a publication year to a downloaded document: URL first, then file name, then the
 * document's opening text. The first stage that finds an in-range year wins.
 */
@Service
@Slf4j
public class YearResolver {

    private final List<YearStrategy> strategies;

    @Autowired
    public YearResolver(final TextExtractor textExtractor) {
        this(List.of(new UrlYearStrategy(), new FilenameYearStrategy(), new ContentYearStrategy(textExtractor)));
    }

    public YearResolver(final List<YearStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @return the detected year, or {@code null} when every stage failed
     */
    public Integer resolve(final String url, final String filename, final Path document) {
        final YearEvidence evidence = new YearEvidence(url, filename, document);
        for (final YearStrategy strategy : strategies) {
            final Optional<Integer> year = strategy.detect(evidence);
            if (year.isPresent()) {
                log.debug("Year {} from {} for {}", year.get(), strategy.name(), filename);
                return year.get();
            }
        }
        log.debug("No year found for {}", filename);
        return null;
    }
}
