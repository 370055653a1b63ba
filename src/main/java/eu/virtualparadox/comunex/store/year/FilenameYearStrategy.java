package eu.virtualparadox.comunex.store.year;

import java.util.Optional;

public class FilenameYearStrategy implements YearStrategy {

    @Override
    public String name() {
        return "filename";
    }

    @Override
    public Optional<Integer> detect(final YearEvidence evidence) {
        return YearPatterns.latestIn(evidence.filename());
    }
}
