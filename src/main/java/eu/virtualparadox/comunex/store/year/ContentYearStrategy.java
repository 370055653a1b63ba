package eu.virtualparadox.comunex.store.year;

import eu.virtualparadox.comunex.ingest.extractor.TextExtractor;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Reads the first two pages and picks the year mentioned most often in their opening text.
 */
@RequiredArgsConstructor
public class ContentYearStrategy implements YearStrategy {

    static final int PAGES = 2;
    static final int MAX_CHARS = 5_000;

    private final TextExtractor textExtractor;

    @Override
    public String name() {
        return "content";
    }

    @Override
    public Optional<Integer> detect(final YearEvidence evidence) {
        if (evidence.document() == null) {
            return Optional.empty();
        }
        return YearPatterns.mostFrequentIn(textExtractor.firstPages(evidence.document(), PAGES), MAX_CHARS);
    }
}
