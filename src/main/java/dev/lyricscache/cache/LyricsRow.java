package dev.lyricscache.cache;

import dev.lyricscache.codec.CompressionStats;

import java.util.Map;

/**
 * One lyrics row as serialized into the RocksDB value.
 *
 * @param song        normalized song
 * @param artist      normalized artist, null when absent
 * @param payload     zlib+base64 lyrics
 * @param compression stats of {@code payload}
 * @param metadata    free-form provenance
 * @param language    coarse script hint
 * @param sourceUrl   source locator taken from {@code metadata.source}
 * @param createdAt   epoch millis of first insert
 * @param accessedAt  epoch millis of last read or write
 * @param sequence    insertion sequence, breaks access-time ties
 */
public record LyricsRow(
        String song,
        String artist,
        String payload,
        CompressionStats compression,
        Map<String, Object> metadata,
        String language,
        String sourceUrl,
        long createdAt,
        long accessedAt,
        long sequence
) {
    public LyricsRow withAccessedAt(long millis) {
        return new LyricsRow(song, artist, payload, compression, metadata, language, sourceUrl,
                createdAt, millis, sequence);
    }
}
