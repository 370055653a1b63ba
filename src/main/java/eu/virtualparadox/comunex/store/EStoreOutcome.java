package eu.virtualparadox.comunex.store;

public enum EStoreOutcome {
    /** New content, written to the year partition and recorded. */
    DOWNLOADED,
    /** URL already stored and its file still on disk; nothing fetched. */
    CACHED,
    /** Content already stored from another URL; this URL was added as an alias. */
    DEDUPLICATED,
    /** Unreachable, non-200, or not a PDF. */
    FAILED
}
