package eu.virtualparadox.comunex.ingest.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StageTrackerTest {

    @Test
    @DisplayName("Outcomes recorded from several threads add up in the stats")
    void concurrentCounts() throws InterruptedException {
        final StageTracker tracker = new StageTracker("download");
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 400; i++) {
            final int item = i;
            pool.execute(() -> {
                tracker.attempted();
                switch (item % 4) {
                    case 0 -> tracker.succeeded();
                    case 1 -> tracker.cached();
                    case 2 -> tracker.deduplicated();
                    default -> tracker.failed();
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        final StageStats stats = tracker.toStats();

        assertEquals("download", stats.stage());
        assertEquals(400, stats.attempted());
        assertEquals(100, stats.succeeded());
        assertEquals(100, stats.cached());
        assertEquals(100, stats.deduplicated());
        assertEquals(100, stats.failed());
        assertTrue(stats.elapsedMillis() >= 0);
    }
}
