package com.landrop.transfer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class UploadSessionRegistryTest {

    private UploadSessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new UploadSessionRegistry();
    }

    @Test
    void beginAdvanceSnapshotEnd() {
        registry.begin("s1", 100);
        registry.advance("s1", 30);
        registry.advance("s1", 20);

        ProgressSnapshot snapshot = registry.snapshot("s1").orElseThrow();
        assertEquals(100, snapshot.getTotal());
        assertEquals(50, snapshot.getUploaded());
        assertEquals(1, registry.activeCount());

        registry.end("s1");
        assertTrue(registry.snapshot("s1").isEmpty());
        assertEquals(0, registry.activeCount());
    }

    @Test
    void duplicateSessionIdIsRejected() {
        registry.begin("dup", 10);
        registry.advance("dup", 4);

        SessionInUseException e = assertThrows(SessionInUseException.class, () -> registry.begin("dup", 99));
        assertEquals("dup", e.getSessionId());
        // 原记录不受影响
        assertEquals(new ProgressSnapshot(10, 4), registry.snapshot("dup").orElseThrow());
    }

    @Test
    void endIsIdempotent() {
        registry.end("never-started");
        registry.begin("s", 1);
        registry.end("s");
        registry.end("s");
        registry.end(null);

        assertEquals(0, registry.activeCount());
    }

    @Test
    void advanceOnUnknownSessionIsIgnored() {
        registry.advance("ghost", 10);

        assertTrue(registry.snapshot("ghost").isEmpty());
    }

    @Test
    void uploadedNeverExceedsTotal() {
        registry.begin("s", 10);
        registry.advance("s", 8);
        registry.advance("s", 8);

        assertEquals(10, registry.snapshot("s").orElseThrow().getUploaded());
    }

    @Test
    void zeroSizeSessionCanBeginAndEnd() {
        registry.begin("empty", 0);
        assertEquals(ProgressSnapshot.UNKNOWN, registry.snapshot("empty").orElseThrow());

        registry.end("empty");
        assertTrue(registry.snapshot("empty").isEmpty());
    }

    @Test
    void negativeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.begin("neg", -1));
        assertTrue(registry.snapshot("neg").isEmpty());

        registry.begin("s", 5);
        assertThrows(IllegalArgumentException.class, () -> registry.advance("s", -1));
    }

    @Test
    void concurrentWritersAndReadersObserveMonotonicBoundedProgress() {
        long total = 1_000_000;
        int writers = 4;
        registry.begin("hot", total);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
            CountDownLatch go = new CountDownLatch(1);
            AtomicBoolean done = new AtomicBoolean();
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < total / writers / 10; i++) {
                        registry.advance("hot", 10);
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 2; r++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    long last = 0;
                    while (!done.get()) {
                        ProgressSnapshot s = registry.snapshot("hot").orElseThrow();
                        assertTrue(s.getUploaded() >= last, "progress went backwards");
                        assertTrue(s.getUploaded() <= s.getTotal(), "uploaded exceeded total");
                        last = s.getUploaded();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (int w = 0; w < writers; w++) {
                futures.get(w).get();
            }
            done.set(true);
            for (Future<?> f : futures) {
                f.get();
            }
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        });

        assertEquals(total, registry.snapshot("hot").orElseThrow().getUploaded());
    }
}
