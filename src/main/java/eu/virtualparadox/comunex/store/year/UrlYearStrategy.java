package eu.virtualparadox.comunex.store.year;

import java.util.Optional;

public class UrlYearStrategy implements YearStrategy {

    @Override
    public String name() {
        return "url";
    }

    @Override
    public Optional<Integer> detect(final YearEvidence evidence) {
        return YearPatterns.latestIn(evidence.url());
    }
}
