package dev.lyricscache.api;

import java.time.Instant;

/**
 * One line of a cache listing.
 *
 * @param song         normalized or recovered primary identifier
 * @param artist       secondary identifier, null when the entry has none
 * @param cachedAt     creation time of the entry
 * @param lastAccessed last read or write of the entry
 * @param sizeBytes    stored size (encoded payload for RocksDB rows, file size for records)
 * @param location     file path for record files, null for RocksDB rows
 * @param source       whether the fields were parsed or recovered best-effort
 */
public record CacheListing(
        String song,
        String artist,
        Instant cachedAt,
        Instant lastAccessed,
        long sizeBytes,
        String location,
        ListingSource source
) {
    public boolean isDegraded() {
        return source != ListingSource.PARSED;
    }
}
