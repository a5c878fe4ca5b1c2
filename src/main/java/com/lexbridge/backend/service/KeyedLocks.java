package com.lexbridge.backend.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutual exclusion by key. Two keys may share a stripe, which only
 * costs throughput; one key always maps to the same lock.
 */
@Component
public class KeyedLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public KeyedLocks() {
        this(DEFAULT_STRIPES);
    }

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> work) {
        ReentrantLock lock = stripes[Math.floorMod(key == null ? 0 : key.hashCode(), stripes.length)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
