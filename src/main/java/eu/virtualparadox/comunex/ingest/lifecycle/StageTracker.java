package eu.virtualparadox.comunex.ingest.lifecycle;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts outcomes of one stage while its workers run. Safe to update from several threads.
 */
public final class StageTracker {

    @Getter
    private final String stage;
    private final long startedAt = System.nanoTime();
    private final AtomicInteger attempted = new AtomicInteger();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger cached = new AtomicInteger();
    private final AtomicInteger deduplicated = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public StageTracker(final String stage) {
        this.stage = stage;
    }

    public void attempted() {
        attempted.incrementAndGet();
    }

    public void succeeded() {
        succeeded.incrementAndGet();
    }

    public void cached() {
        cached.incrementAndGet();
    }

    public void deduplicated() {
        deduplicated.incrementAndGet();
    }

    public void failed() {
        failed.incrementAndGet();
    }

    public StageStats toStats() {
        return new StageStats(stage,
                attempted.get(),
                succeeded.get(),
                cached.get(),
                deduplicated.get(),
                failed.get(),
                (System.nanoTime() - startedAt) / 1_000_000L);
    }
}
