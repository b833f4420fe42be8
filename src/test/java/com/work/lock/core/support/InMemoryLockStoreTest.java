package com.work.lock.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryLockStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryLockStore store = new InMemoryLockStore(clock);

    @Test
    public void second_create_is_refused_while_record_is_live() {
        assertTrue(store.tryCreate("job-x", "a", Duration.ofSeconds(60)));
        assertFalse(store.tryCreate("job-x", "b", Duration.ofSeconds(60)));
        assertFalse(store.tryCreate("job-x", "a", Duration.ofSeconds(60)));
        assertEquals("a", store.readOwner("job-x").orElse(null));
    }

    @Test
    public void expired_record_is_treated_as_absent() {
        assertTrue(store.tryCreate("job-y", "a", Duration.ofSeconds(1)));

        clock.advance(Duration.ofMillis(999));
        assertTrue(store.readOwner("job-y").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertFalse(store.readOwner("job-y").isPresent());
        assertEquals(0, store.size());

        assertTrue(store.tryCreate("job-y", "b", Duration.ofSeconds(1)));
        assertEquals("b", store.readOwner("job-y").orElse(null));
    }

    @Test
    public void delete_by_non_owner_keeps_record() {
        store.tryCreate("job-x", "a", Duration.ofSeconds(60));

        assertFalse(store.deleteIfOwner("job-x", "b"));
        assertEquals("a", store.readOwner("job-x").orElse(null));

        assertTrue(store.deleteIfOwner("job-x", "a"));
        assertFalse(store.readOwner("job-x").isPresent());
    }

    @Test
    public void purge_removes_only_expired_records() {
        store.tryCreate("short", "a", Duration.ofSeconds(1));
        store.tryCreate("long", "a", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, store.purgeExpired());
        assertEquals(1, store.size());
        assertTrue(store.readOwner("long").isPresent());
    }

    @Test
    public void concurrent_creates_yield_single_winner() throws Exception {
        InMemoryLockStore shared = new InMemoryLockStore();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String owner = "owner-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return shared.tryCreate("contended", owner, Duration.ofSeconds(30));
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void rejects_blank_arguments() {
        assertThrows(IllegalArgumentException.class, () -> store.tryCreate(" ", "a", Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> store.tryCreate("k", "a", Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> store.deleteIfOwner("k", null));
    }
}
