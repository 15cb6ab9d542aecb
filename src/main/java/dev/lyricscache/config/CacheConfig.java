package dev.lyricscache.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Settings for both cache backends and the read-through client.
 *
 * <p>Instances are passed explicitly to constructors; nothing here reads the environment.
 * Callers that want flag or environment overrides apply them with the chained setters.
 */
@Getter
@Setter
@Accessors(chain = true)
public class CacheConfig {
    // Paths
    private String basePath = "./data/lyrics-cache";
    private String lyricsStoreName = "lyrics";        // RocksDB directory under basePath
    private String vocabularyStoreName = "vocab";     // JSON record directory under basePath

    // RocksDB
    private boolean syncWrites = false;       // WAL fsync on each write
    private boolean disableWAL = false;       // keep WAL by default
    private int writeBufferSizeMB = 16;       // per memtable
    private int maxWriteBufferNumber = 2;
    private CompressionType compressionType = CompressionType.NO_COMPRESSION; // payloads arrive zlib-compressed

    // Codec
    private int compressionLevel = 6;         // zlib level 0..9

    // Eviction defaults used by the client's no-arg overloads
    private int defaultMaxEntries = 1000;
    private int defaultMaxAgeDays = 90;

    // Read-through behavior
    private boolean coalesceMisses = true;    // single flight per key on cache miss
}
