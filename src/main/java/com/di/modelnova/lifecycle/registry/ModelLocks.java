package com.di.modelnova.lifecycle.registry;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key (a model id, a run or an A/B test). Promotions of different models never wait on
 * each other.
 * <p>
 * Entries are counted by the callers holding or waiting on them and removed when the last one leaves, so keys
 * for short-lived runs and tests do not accumulate.
 */
@Component
public class ModelLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry held = existing != null ? existing : new Entry();
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    /** Number of keys currently held or waited on. */
    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int users;
    }
}
