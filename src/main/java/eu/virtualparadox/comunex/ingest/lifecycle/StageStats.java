package eu.virtualparadox.comunex.ingest.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary counts of one pipeline stage.
 *
 * @param stage         stage name
 * @param attempted     items the stage tried to process
 * @param succeeded     items processed with fresh work
 * @param cached        items served from a persistent cache
 * @param deduplicated  items recognized as duplicates of stored content
 * @param failed        items that failed and were skipped
 * @param elapsedMillis wall-clock duration of the stage
 */
public record StageStats(String stage,
                         int attempted,
                         int succeeded,
                         int cached,
                         int deduplicated,
                         int failed,
                         long elapsedMillis) {

    /**
     * Share of attempted items answered from cache, 0 when nothing was attempted.
     */
    @JsonProperty("cacheHitRate")
    public double cacheHitRate() {
        return attempted == 0 ? 0.0 : (double) cached / attempted;
    }
}
