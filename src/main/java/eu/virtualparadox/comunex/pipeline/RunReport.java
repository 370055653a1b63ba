package eu.virtualparadox.comunex.pipeline;

import eu.virtualparadox.comunex.catalog.service.CatalogStats;
import eu.virtualparadox.comunex.ingest.lifecycle.StageStats;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one pipeline run, written next to the outputs.
 */
public record RunReport(String comune,
                        List<Integer> years,
                        Instant startedAt,
                        Instant finishedAt,
                        List<StageStats> stages,
                        CatalogStats catalog,
                        int indexedChunks,
                        int valuesFound,
                        int valuesNotFound) {

    public RunReport {
        years = List.copyOf(years);
        stages = List.copyOf(stages);
    }
}
