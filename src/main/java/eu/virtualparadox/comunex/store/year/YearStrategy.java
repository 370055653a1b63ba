package eu.virtualparadox.comunex.store.year;

import java.util.Optional;

/**
 * One stage of year detection. An empty result hands over to the next stage.
 */
public interface YearStrategy {

    String name();

    Optional<Integer> detect(YearEvidence evidence);
}
