package dev.lyricscache.codec;

/**
 * Size statistics for one compressed payload. {@code compressionRatio} is original bytes divided by
 * encoded (Base64) characters, so it reflects what the store actually keeps.
 */
public record CompressionStats(
        long originalSizeBytes,
        long compressedSizeBytes,
        long encodedSizeBytes,
        double compressionRatio,
        String compressionMethod,
        int compressionLevel
) {
}
