package dev.lyricscache.core;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion with reference-counted lock entries, so the map only holds keys that
 * currently have a holder or a waiter.
 *
 * @param <K> key type, must implement equals/hashCode
 */
public final class KeyedLocks<K> {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final ConcurrentHashMap<K, Entry> entries = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Objects.requireNonNull(key, "key cannot be null");
        Entry entry = entries.compute(key, (k, e) -> {
            Entry held = (e == null) ? new Entry() : e;
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            entries.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    int activeKeys() {
        return entries.size();
    }
}
