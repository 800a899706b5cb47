package com.gt.recall.util;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks addressed by key hash. Two keys may share a stripe, which only costs contention; the same key
 * always maps to the same lock.
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be at least 1, was " + stripeCount);
        }

        this.stripes = new ReentrantLock[stripeCount];
        for (int index = 0; index < stripeCount; index++) {
            stripes[index] = new ReentrantLock();
        }
    }

    public <T> T withLock(Object key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);

        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int stripeIndex(Object key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    private ReentrantLock lockFor(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Lock key is required");
        }
        return stripes[stripeIndex(key)];
    }
}
