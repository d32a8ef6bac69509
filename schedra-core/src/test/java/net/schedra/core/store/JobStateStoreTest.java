package net.schedra.core.store;

import net.schedra.core.model.JobState;
import net.schedra.core.model.PersistedJobState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStateStoreTest {

    final JobStateStore store = new JobStateStore();

    @Test
    void try_acquire_respects_max_running() {
        Optional<RunPermit> first = store.tryAcquire("job", 1);
        Optional<RunPermit> second = store.tryAcquire("job", 1);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, store.status("job").orElseThrow().runningCount());
    }

    @Test
    void release_is_idempotent() {
        RunPermit p1 = store.tryAcquire("job", 2).orElseThrow();
        RunPermit p2 = store.tryAcquire("job", 2).orElseThrow();

        p1.close();
        p1.close();

        assertEquals(1, store.status("job").orElseThrow().runningCount());
        p2.close();
        assertEquals(0, store.status("job").orElseThrow().runningCount());
    }

    @Test
    void set_keeps_live_running_count() {
        JobState snapshot = store.getOrCreate("job");
        store.tryAcquire("job", 1).orElseThrow();

        snapshot.setNextFireTime(Instant.parse("2017-11-29T15:00:00Z"));
        store.set("job", snapshot);

        assertEquals(1, store.status("job").orElseThrow().runningCount());
        assertEquals(Instant.parse("2017-11-29T15:00:00Z"), store.get("job").orElseThrow().nextFireTime());
    }

    @Test
    void export_is_sorted_and_restorable() {
        store.update("b", s -> s.markFired(Instant.parse("2017-11-29T15:00:00Z"), null, Instant.parse("2017-11-29T15:01:00Z")));
        store.update("a", s -> s.setOnceTarget(Instant.parse("2017-11-29T16:00:00Z")));

        Map<String, PersistedJobState> exported = store.export();
        assertEquals(List.of("a", "b"), List.copyOf(exported.keySet()));

        JobStateStore other = new JobStateStore();
        other.restore(exported);
        assertEquals(exported, other.export());
    }

    @Test
    void concurrent_acquires_never_exceed_max() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        for (int i = 0; i < 64; i++) {
            pool.submit(() -> {
                start.await();
                store.tryAcquire("job", 3).ifPresent(p -> granted.incrementAndGet());
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(3, granted.get());
        assertEquals(3, store.status("job").orElseThrow().runningCount());
    }

    @Test
    void release_after_remove_is_harmless() {
        RunPermit p = store.tryAcquire("job", 1).orElseThrow();
        store.remove("job");

        p.close();

        assertTrue(store.status("job").isEmpty());
    }

    @Test
    void update_if_present_does_not_recreate_removed_job() {
        store.getOrCreate("job");
        store.remove("job");

        boolean applied = store.updateIfPresent("job", s -> s.setRunCount(3));

        assertFalse(applied);
        assertTrue(store.status("job").isEmpty());
        assertTrue(store.export().isEmpty());
    }
}
