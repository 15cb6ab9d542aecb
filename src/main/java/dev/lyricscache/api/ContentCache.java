package dev.lyricscache.api;

import dev.lyricscache.core.CacheKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key to payload storage shared by the lyrics and vocabulary caches.
 *
 * <p>Semantics common to every backend:
 * - At most one entry per normalized {@link CacheKey}; an absent secondary only matches entries
 *   without one.
 * - {@link #put} replaces the payload of an existing entry in place, keeping its creation time.
 *   A reader sees either the old or the new payload, never a partial one.
 * - {@link #get} refreshes the entry's last-access time and leaves the payload untouched.
 * - Failures surface as {@link dev.lyricscache.core.CacheStoreException}; a payload that cannot be
 *   decoded surfaces as {@link dev.lyricscache.core.DecodeException}.
 *
 * @param <V> payload type
 */
public interface ContentCache<V> extends AutoCloseable {

    /**
     * Short name used in logs (for example {@code lyrics}).
     */
    String name();

    Optional<StoredEntry<V>> get(CacheKey key);

    /**
     * Inserts or replaces the entry for {@code key}.
     *
     * @param metadata free-form provenance (source locator, fetch time, flags); may be empty
     * @return the entry as stored
     */
    StoredEntry<V> put(CacheKey key, V value, Map<String, Object> metadata);

    /**
     * Snapshot of all entries, most recently accessed first.
     */
    List<CacheListing> list();

    boolean delete(CacheKey key);

    long count();

    long totalBytes();

    /**
     * Deletes every entry created strictly before {@code cutoff}.
     *
     * @return number of deleted entries
     */
    int deleteOlderThan(Instant cutoff);

    /**
     * Deletes least recently accessed entries (oldest insertion first on ties) until at most
     * {@code keepCount} remain.
     *
     * @return number of deleted entries
     */
    int deleteLeastRecentlyAccessedExcess(int keepCount);

    @Override
    void close();
}
