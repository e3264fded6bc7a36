package com.herzen.coach;

import com.herzen.coach.support.KeyedLocks;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLocksTest {
    private final KeyedLocks locks = new KeyedLocks();

    @Test
    void entriesAreReleasedAfterUse() {
        for (int i = 0; i < 10_000; i++) {
            String key = "user-" + i;
            assertEquals(key, locks.withLock(key, () -> key));
        }

        assertEquals(0, locks.activeKeys());
    }

    @Test
    void entryIsReleasedWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("failing", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, locks.activeKeys());
    }

    @Test
    void sameKeyRunsOneAtATime() throws Exception {
        int threads = 8;
        int perThread = 500;
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        locks.withLock("shared", () -> counter[0]++);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, counter[0]);
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void keyStaysWhileHeld() {
        int inside = locks.withLock("held", locks::activeKeys);

        assertEquals(1, inside);
        assertEquals(0, locks.activeKeys());
    }
}
