package dev.lyricscache.codec;

import java.util.Objects;

/**
 * Text-safe encoded payload and the statistics of the compression that produced it.
 */
public record Compressed(String encoded, CompressionStats stats) {
    public Compressed {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        Objects.requireNonNull(stats, "stats cannot be null");
    }
}
