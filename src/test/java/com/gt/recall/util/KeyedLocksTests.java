package com.gt.recall.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(SpringExtension.class)
public class KeyedLocksTests {

    @Test
    public void testSameKeyIsSerialized() throws Exception {
        KeyedLocks locks = new KeyedLocks(16);
        int[] counter = new int[1];

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int task = 0; task < 8; task++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        locks.withLock("item:user", () -> {
                            int read = counter[0];
                            Thread.yield();
                            counter[0] = read + 1;
                            return null;
                        });
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(8000, counter[0]);
    }

    @Test
    public void testStripeIndexStable() {
        KeyedLocks locks = new KeyedLocks(7);

        int index = locks.stripeIndex("some-key");
        assertEquals(index, locks.stripeIndex("some-key"));
        assertTrue(index >= 0 && index < 7);
    }

    @Test
    public void testReturnsActionResult() {
        assertEquals("done", new KeyedLocks(1).withLock("key", () -> "done"));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new KeyedLocks(0));
        assertThrows(IllegalArgumentException.class, () -> new KeyedLocks(4).withLock(null, () -> "x"));
    }
}
