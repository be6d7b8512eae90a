package com.zzf.workspace.core.workspace;

import com.zzf.workspace.core.workspace.error.ReadRequiredException;
import com.zzf.workspace.core.workspace.error.StaleReadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadTrackerTest {

    private final Map<String, ReadVersion> files = new ConcurrentHashMap<>();
    private final MutableClock clock = new MutableClock();
    private final OperationKey op1 = OperationKey.of("op-1", null, null);
    private final OperationKey op2 = OperationKey.of("op-2", null, null);

    private ReadTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ReadTracker(path -> Optional.ofNullable(files.get(path)), 16, Duration.ofMinutes(30), clock);
        files.put("/f", new ReadVersion(1_000L, 10L));
    }

    @Test
    void writeWithoutReadIsRejected() {
        ReadRequiredException e = assertThrows(ReadRequiredException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
        assertTrue(e.isRecoverable());
    }

    @Test
    void writeAfterReadOfUntouchedFilePasses() {
        tracker.recordRead(op1, "/f");

        assertDoesNotThrow(() -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void sizeChangeMakesReadStale() {
        tracker.recordRead(op1, "/f");
        files.put("/f", new ReadVersion(1_000L, 11L));

        StaleReadException e = assertThrows(StaleReadException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
        assertFalse(e.isDeleted());
        assertEquals("stale_read", e.getCode());
    }

    @Test
    void mtimeChangeMakesReadStale() {
        tracker.recordRead(op1, "/f");
        files.put("/f", new ReadVersion(2_000L, 10L));

        assertThrows(StaleReadException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void deletionMakesReadStale() {
        tracker.recordRead(op1, "/f");
        files.remove("/f");

        StaleReadException e = assertThrows(StaleReadException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
        assertTrue(e.isDeleted());
    }

    @Test
    void readOfMissingPathRecordsNothing() {
        tracker.recordRead(op1, "/missing");
        files.put("/missing", new ReadVersion(1L, 1L));

        assertThrows(ReadRequiredException.class, () -> tracker.assertReadBeforeWrite(op1, "/missing"));
    }

    @Test
    void readsAreScopedToTheirOperation() {
        tracker.recordRead(op1, "/f");

        assertThrows(ReadRequiredException.class, () -> tracker.assertReadBeforeWrite(op2, "/f"));
    }

    @Test
    void refreshAfterWriteRebaselinesOwnChange() {
        tracker.recordRead(op1, "/f");
        files.put("/f", new ReadVersion(3_000L, 42L));
        tracker.refreshAfterWrite(op1, "/f");

        assertDoesNotThrow(() -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void refreshAfterWriteDoesNotCreateBaseline() {
        tracker.refreshAfterWrite(op1, "/f");

        assertThrows(ReadRequiredException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void leastRecentlyUsedOperationIsEvictedAtCapacity() {
        ReadTracker small = new ReadTracker(path -> Optional.ofNullable(files.get(path)), 2, null, clock);
        OperationKey op3 = OperationKey.of("op-3", null, null);
        small.recordRead(op1, "/f");
        small.recordRead(op2, "/f");
        small.recordRead(op3, "/f");

        assertEquals(2, small.trackedOperations());
        assertThrows(ReadRequiredException.class, () -> small.assertReadBeforeWrite(op1, "/f"));
        assertDoesNotThrow(() -> small.assertReadBeforeWrite(op3, "/f"));
    }

    @Test
    void idleOperationsExpire() {
        tracker.recordRead(op1, "/f");
        clock.advance(Duration.ofMinutes(31));

        assertEquals(0, tracker.trackedOperations());
        assertThrows(ReadRequiredException.class, () -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void activeOperationsSurviveIdleTimeout() {
        tracker.recordRead(op1, "/f");
        clock.advance(Duration.ofMinutes(20));
        tracker.assertReadBeforeWrite(op1, "/f");
        clock.advance(Duration.ofMinutes(20));

        assertDoesNotThrow(() -> tracker.assertReadBeforeWrite(op1, "/f"));
    }

    @Test
    void concurrentReadsOfOneOperationAreAllRecorded() throws Exception {
        int threads = 8;
        int pathsPerThread = 50;
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < pathsPerThread; i++) {
                files.put("/t" + t + "/f" + i, new ReadVersion(i, t));
            }
        }
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < pathsPerThread; i++) {
                        tracker.recordRead(op1, "/t" + thread + "/f" + i);
                        tracker.refreshAfterWrite(op1, "/t" + thread + "/f" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, tracker.trackedOperations());
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < pathsPerThread; i++) {
                String path = "/t" + t + "/f" + i;
                assertDoesNotThrow(() -> tracker.assertReadBeforeWrite(op1, path));
            }
        }
    }

    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
