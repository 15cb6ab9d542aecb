package dev.lyricscache.api;

import dev.lyricscache.codec.CompressionStats;
import dev.lyricscache.core.CacheKey;

import java.time.Instant;
import java.util.Map;

/**
 * A decoded cache entry as returned by {@link ContentCache#get} and {@link ContentCache#put}.
 *
 * @param compression stats of the stored payload; null for backends that store payloads as-is
 * @param language    coarse script hint; null for backends that do not record one
 * @param location    file path for file-backed entries, null otherwise
 */
public record StoredEntry<V>(
        CacheKey key,
        V value,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant accessedAt,
        CompressionStats compression,
        String language,
        String location
) {
}
