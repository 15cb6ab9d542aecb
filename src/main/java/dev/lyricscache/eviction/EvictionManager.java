package dev.lyricscache.eviction;

import dev.lyricscache.api.ContentCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bounds a {@link ContentCache} by age and by count.
 *
 * <p>A run has two phases, always in this order:
 * <ol>
 *   <li>delete every entry created before {@code now - maxAgeDays};</li>
 *   <li>if more than {@code maxEntries} remain, delete the least recently accessed entries
 *       (oldest insertion first on ties) until exactly {@code maxEntries} remain.</li>
 * </ol>
 * Nothing runs automatically; an external scheduler decides when to call {@link #evict}.
 */
public class EvictionManager {
    private static final Logger logger = LoggerFactory.getLogger(EvictionManager.class);

    private final Clock clock;

    public EvictionManager() {
        this(null);
    }

    public EvictionManager(Clock clock) {
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * @throws IllegalArgumentException if either bound is negative
     * @throws dev.lyricscache.core.CacheStoreException if the store fails during the run
     */
    public EvictionStats evict(ContentCache<?> store, int maxEntries, int maxAgeDays) {
        Objects.requireNonNull(store, "store cannot be null");
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries cannot be negative");
        }
        if (maxAgeDays < 0) {
            throw new IllegalArgumentException("maxAgeDays cannot be negative");
        }

        long initialCount = store.count();
        if (initialCount == 0) {
            logger.debug("Store '{}' is empty, nothing to evict", store.name());
            return EvictionStats.empty();
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        int deletedOld = store.deleteOlderThan(cutoff);

        int deletedExcess = 0;
        if (store.count() > maxEntries) {
            deletedExcess = store.deleteLeastRecentlyAccessedExcess(maxEntries);
        }

        EvictionStats stats = new EvictionStats(true, initialCount, deletedOld, deletedExcess,
                store.count(), store.totalBytes(), null);
        logger.info("Cache cleanup for '{}': initial={}, deletedOld={}, deletedExcess={}, final={}, bytes={}",
                store.name(), stats.initialCount(), deletedOld, deletedExcess, stats.finalCount(), stats.totalBytes());
        return stats;
    }
}
