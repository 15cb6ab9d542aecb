package dev.lyricscache.client;

import dev.lyricscache.codec.CompressionStats;

import java.time.Instant;

/**
 * Provenance of a returned value.
 *
 * @param fromCache   true when served from the cache without calling a collaborator
 * @param cachedAt    creation time of the cache entry; null for fresh values that could not be stored
 * @param compression stats of the stored lyrics payload; null for vocabulary or unstored values
 * @param language    coarse script hint, lyrics only
 * @param location    record file path, vocabulary only
 * @param mock        true when the value is the deterministic placeholder
 */
public record CacheInfo(
        boolean fromCache,
        Instant cachedAt,
        CompressionStats compression,
        String language,
        String location,
        boolean mock
) {
}
