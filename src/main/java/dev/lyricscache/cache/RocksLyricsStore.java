package dev.lyricscache.cache;

import dev.lyricscache.api.CacheListing;
import dev.lyricscache.api.ContentCache;
import dev.lyricscache.api.ListingSource;
import dev.lyricscache.api.StoredEntry;
import dev.lyricscache.codec.CompressionCodec;
import dev.lyricscache.codec.Compressed;
import dev.lyricscache.config.CacheConfig;
import dev.lyricscache.core.CacheKey;
import dev.lyricscache.core.CacheStoreException;
import dev.lyricscache.core.DecodeException;
import dev.lyricscache.core.KeyEncoder;
import dev.lyricscache.core.LanguageHint;
import dev.lyricscache.core.MappedLongCounter;
import dev.lyricscache.ser.JsonSerializer;
import dev.lyricscache.ser.Serializer;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Raw-text cache backed by an embedded RocksDB instance.
 *
 * <p>Each normalized (song, artist) pair maps to one row key built by {@link KeyEncoder}; the value is
 * a JSON-serialized {@link LyricsRow} holding the zlib+base64 lyrics, compression stats, provenance
 * metadata and timestamps. Because the row key is derived from the normalized pair, a second write
 * for the same key replaces the row instead of adding one.
 *
 * <p><strong>Thread Safety:</strong> read-modify-write sequences (touch on read, insert-or-update,
 * eviction batches) run under a single write lock, so each one is atomic with respect to the others.
 * Listing reads from a RocksDB snapshot and does not take the lock.
 *
 * <p><strong>Resource Management:</strong> RocksDB allows one open handle per directory per process,
 * so the handle lives as long as this store. Per-call resources (read options, snapshots, iterators,
 * write batches) are scoped to the call. Close the store to persist the insertion sequence and
 * release the database.
 *
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setBasePath("/tmp/lyrics-cache");
 * try (RocksLyricsStore store = new RocksLyricsStore(config)) {
 *     store.put(CacheKey.of("Lemon", "Kenshi Yonezu"), lyrics, Map.of("source", url));
 *     Optional<StoredEntry<String>> hit = store.get(CacheKey.of("lemon", "kenshi yonezu"));
 * }
 * }</pre>
 */
public class RocksLyricsStore implements ContentCache<String> {
    private static final Logger logger = LoggerFactory.getLogger(RocksLyricsStore.class);

    static final String META_SEQUENCE_KEY = "meta:insertion_sequence";
    private static final String COUNTER_FILE_NAME = "insertion.counter";

    static { RocksDB.loadLibrary(); }

    private final String name;
    private final Path path;
    private final RocksDB db;
    private final MappedLongCounter sequence;
    private final Serializer<LyricsRow> serializer;
    private final CompressionCodec codec;
    private final Clock clock;
    private final WriteOptions writeOpts;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private record RowRef(byte[] key, LyricsRow row, long valueLength) {
        long createdAt() {
            return row == null ? 0L : row.createdAt();
        }

        long accessedAt() {
            return row == null ? 0L : row.accessedAt();
        }

        long sequence() {
            return row == null ? 0L : row.sequence();
        }
    }

    // Least recently accessed first, oldest insertion first on ties. Unparseable rows sort first.
    private static final Comparator<RowRef> LRU_ORDER =
            Comparator.comparingLong(RowRef::accessedAt).thenComparingLong(RowRef::sequence);

    public RocksLyricsStore(CacheConfig config) {
        this(config, null);
    }

    public RocksLyricsStore(CacheConfig config, Clock clock) {
        this(config, new JsonSerializer<>(LyricsRow.class), new CompressionCodec(config.getCompressionLevel()), clock);
    }

    /**
     * @param config     store location and RocksDB settings
     * @param serializer row serializer
     * @param codec      payload codec
     * @param clock      time source for created/accessed timestamps, null for system UTC
     * @throws CacheStoreException if the directory or the database cannot be opened
     */
    public RocksLyricsStore(CacheConfig config, Serializer<LyricsRow> serializer, CompressionCodec codec, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.name = config.getLyricsStoreName();
        this.path = Paths.get(config.getBasePath(), name);

        MDC.put("cacheStore", name);
        try {
            try {
                Files.createDirectories(path);
                logger.debug("Opening RocksDB at path: {}", path);
                try (Options options = new Options()
                        .setCreateIfMissing(true)
                        .setCompressionType(config.getCompressionType())
                        .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                        .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())) {
                    this.db = RocksDB.open(options, path.toString());
                }
            } catch (Exception e) {
                logger.error("Failed to open RocksDB for store '{}' at {}: {}", name, path, e.getMessage(), e);
                throw new CacheStoreException("Failed to open RocksDB for store=" + name + " at " + path, e);
            }

            this.writeOpts = new WriteOptions()
                    .setSync(config.isSyncWrites())
                    .setDisableWAL(config.isDisableWAL());

            try {
                MappedLongCounter mapped = MappedLongCounter.open(path.resolve(COUNTER_FILE_NAME));
                long recovered = recoverSequence();
                if (recovered > mapped.get()) {
                    logger.info("Sequence recovery: updating from {} to {} for store '{}'", mapped.get(), recovered, name);
                    mapped.set(recovered);
                }
                this.sequence = mapped;
            } catch (RuntimeException e) {
                logger.error("Failed to initialize insertion sequence for store '{}': {}", name, e.getMessage(), e);
                writeOpts.close();
                db.close();
                throw e;
            }
            logger.info("Opened lyrics store '{}' at {} (sequence={})", name, path, sequence.get());
        } finally {
            MDC.remove("cacheStore");
        }
    }

    @Override
    public String name() {
        return name;
    }

    public Path path() {
        return path;
    }

    @Override
    public Optional<StoredEntry<String>> get(CacheKey key) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        byte[] k = KeyEncoder.encode(key);

        MDC.put("cacheStore", name);
        MDC.put("cacheKey", key.toString());
        try {
            synchronized (writeLock) {
                byte[] raw = db.get(k);
                if (raw == null) {
                    logger.debug("Cache miss for '{}'", key);
                    return Optional.empty();
                }
                LyricsRow row = serializer.decode(raw);
                String text = codec.decompress(row.payload());

                LyricsRow touched = row.withAccessedAt(clock.millis());
                db.put(writeOpts, k, serializer.encode(touched));
                logger.debug("Cache hit for '{}'", key);
                return Optional.of(toEntry(key, touched, text));
            }
        } catch (RocksDBException e) {
            logger.error("Failed to read lyrics for '{}' in store '{}': {}", key, name, e.getMessage(), e);
            throw new CacheStoreException("Failed to read lyrics for key=" + key, e);
        } catch (DecodeException e) {
            logger.error("Stored lyrics for '{}' cannot be decoded: {}", key, e.getMessage());
            throw e;
        } finally {
            MDC.remove("cacheKey");
            MDC.remove("cacheStore");
        }
    }

    @Override
    public StoredEntry<String> put(CacheKey key, String lyrics, Map<String, Object> metadata) {
        checkOpen();
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(lyrics, "lyrics cannot be null");

        Compressed compressed = codec.compress(lyrics);
        Map<String, Object> meta = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        String language = LanguageHint.detect(lyrics);
        Object source = meta.get("source");
        byte[] k = KeyEncoder.encode(key);

        MDC.put("cacheStore", name);
        MDC.put("cacheKey", key.toString());
        try {
            synchronized (writeLock) {
                long now = clock.millis();
                LyricsRow existing = readExisting(k, key);
                long createdAt = existing != null ? existing.createdAt() : now;
                long seq = existing != null ? existing.sequence() : sequence.incrementAndGet();

                LyricsRow row = new LyricsRow(key.primary(), key.secondary(), compressed.encoded(),
                        compressed.stats(), meta, language, source == null ? "" : source.toString(),
                        createdAt, now, seq);
                db.put(writeOpts, k, serializer.encode(row));

                if (existing != null) {
                    logger.info("Updated cache entry for '{}'", key);
                } else {
                    logger.info("Added new cache entry for '{}' (ratio {})", key,
                            String.format("%.2f", compressed.stats().compressionRatio()));
                }
                return toEntry(key, row, lyrics);
            }
        } catch (RocksDBException e) {
            logger.error("Failed to write lyrics for '{}' in store '{}': {}", key, name, e.getMessage(), e);
            throw new CacheStoreException("Failed to write lyrics for key=" + key, e);
        } finally {
            MDC.remove("cacheKey");
            MDC.remove("cacheStore");
        }
    }

    private LyricsRow readExisting(byte[] k, CacheKey key) throws RocksDBException {
        byte[] raw = db.get(k);
        if (raw == null) {
            return null;
        }
        try {
            return serializer.decode(raw);
        } catch (CacheStoreException e) {
            logger.warn("Replacing unreadable row for '{}': {}", key, e.getMessage());
            return null;
        }
    }

    @Override
    public List<CacheListing> list() {
        checkOpen();
        List<RowRef> rows;
        final Snapshot snapshot = db.getSnapshot();
        try (ReadOptions ro = new ReadOptions().setSnapshot(snapshot)) {
            rows = scanRows(ro);
        } finally {
            db.releaseSnapshot(snapshot);
        }

        rows.sort(LRU_ORDER.reversed());
        List<CacheListing> listings = new ArrayList<>(rows.size());
        for (RowRef ref : rows) {
            listings.add(toListing(ref));
        }
        return listings;
    }

    private CacheListing toListing(RowRef ref) {
        LyricsRow row = ref.row();
        if (row != null) {
            return new CacheListing(row.song(), row.artist(),
                    Instant.ofEpochMilli(row.createdAt()), Instant.ofEpochMilli(row.accessedAt()),
                    row.payload() == null ? 0 : row.payload().length(), null, ListingSource.PARSED);
        }
        String song = "unknown";
        String artist = null;
        try {
            CacheKey decoded = KeyEncoder.decode(ref.key());
            song = decoded.primary();
            artist = decoded.secondary();
        } catch (IllegalArgumentException e) {
            logger.warn("Row key in store '{}' cannot be decoded: {}", name, e.getMessage());
        }
        return new CacheListing(song, artist, Instant.EPOCH, Instant.EPOCH, ref.valueLength(), null,
                ListingSource.FALLBACK_FROM_KEY);
    }

    @Override
    public boolean delete(CacheKey key) {
        checkOpen();
        byte[] k = KeyEncoder.encode(key);
        try {
            synchronized (writeLock) {
                if (db.get(k) == null) {
                    return false;
                }
                db.delete(writeOpts, k);
            }
            logger.info("Deleted cache entry for '{}' from store '{}'", key, name);
            return true;
        } catch (RocksDBException e) {
            logger.error("Failed to delete '{}' from store '{}': {}", key, name, e.getMessage(), e);
            throw new CacheStoreException("Failed to delete key=" + key, e);
        }
    }

    @Override
    public long count() {
        checkOpen();
        try (ReadOptions ro = new ReadOptions().setFillCache(false)) {
            return scanRows(ro).size();
        }
    }

    @Override
    public long totalBytes() {
        checkOpen();
        long total = 0;
        try (ReadOptions ro = new ReadOptions().setFillCache(false)) {
            for (RowRef ref : scanRows(ro)) {
                total += (ref.row() != null && ref.row().payload() != null)
                        ? ref.row().payload().length()
                        : ref.valueLength();
            }
        }
        return total;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        checkOpen();
        Objects.requireNonNull(cutoff, "cutoff cannot be null");
        long cutoffMillis = cutoff.toEpochMilli();
        synchronized (writeLock) {
            List<RowRef> victims = new ArrayList<>();
            try (ReadOptions ro = new ReadOptions().setFillCache(false)) {
                for (RowRef ref : scanRows(ro)) {
                    if (ref.createdAt() < cutoffMillis) {
                        victims.add(ref);
                    }
                }
            }
            deleteAll(victims);
            logger.debug("Deleted {} entries created before {} from store '{}'", victims.size(), cutoff, name);
            return victims.size();
        }
    }

    @Override
    public int deleteLeastRecentlyAccessedExcess(int keepCount) {
        checkOpen();
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount cannot be negative");
        }
        synchronized (writeLock) {
            List<RowRef> rows;
            try (ReadOptions ro = new ReadOptions().setFillCache(false)) {
                rows = scanRows(ro);
            }
            int excess = rows.size() - keepCount;
            if (excess <= 0) {
                return 0;
            }
            rows.sort(LRU_ORDER);
            List<RowRef> victims = rows.subList(0, excess);
            deleteAll(victims);
            logger.debug("Deleted {} least recently accessed entries from store '{}'", excess, name);
            return excess;
        }
    }

    private void deleteAll(List<RowRef> victims) {
        if (victims.isEmpty()) {
            return;
        }
        try (WriteBatch batch = new WriteBatch()) {
            for (RowRef ref : victims) {
                batch.delete(ref.key());
            }
            db.write(writeOpts, batch);
        } catch (RocksDBException e) {
            logger.error("Failed to delete {} entries from store '{}': {}", victims.size(), name, e.getMessage(), e);
            throw new CacheStoreException("Failed to delete entries from store=" + name, e);
        }
    }

    /**
     * Reads every row key with its parsed value. Rows whose value cannot be parsed are returned
     * with a null row so callers can list or evict them.
     */
    private List<RowRef> scanRows(ReadOptions ro) {
        List<RowRef> rows = new ArrayList<>();
        try (RocksIterator it = db.newIterator(ro)) {
            for (it.seek(new byte[]{KeyEncoder.ROW_PREFIX}); it.isValid(); it.next()) {
                byte[] k = it.key();
                if (k.length == 0 || k[0] != KeyEncoder.ROW_PREFIX) {
                    break;
                }
                if (!KeyEncoder.isRowKey(k)) {
                    continue;
                }
                byte[] v = it.value();
                LyricsRow row = null;
                try {
                    row = serializer.decode(v);
                } catch (CacheStoreException e) {
                    logger.warn("Unreadable row in store '{}': {}", name, e.getMessage());
                }
                rows.add(new RowRef(k, row, v.length));
            }
            it.status();
        } catch (RocksDBException e) {
            logger.error("Failed to scan store '{}': {}", name, e.getMessage(), e);
            throw new CacheStoreException("Failed to scan store=" + name, e);
        }
        return rows;
    }

    /**
     * Highest insertion sequence known to the database: the value persisted on the last clean
     * close, or the largest sequence found in the rows when that value is missing or stale.
     */
    private long recoverSequence() {
        long fromMeta = 0L;
        try {
            byte[] metaBytes = db.get(META_SEQUENCE_KEY.getBytes(StandardCharsets.UTF_8));
            if (metaBytes != null && metaBytes.length == 8) {
                fromMeta = ByteBuffer.wrap(metaBytes).order(ByteOrder.BIG_ENDIAN).getLong();
            }
        } catch (RocksDBException e) {
            logger.debug("Failed to read sequence metadata for store '{}', falling back to data scan: {}",
                    name, e.getMessage());
        }
        long fromData = 0L;
        try (ReadOptions ro = new ReadOptions().setFillCache(false)) {
            for (RowRef ref : scanRows(ro)) {
                fromData = Math.max(fromData, ref.sequence());
            }
        }
        if (fromData > fromMeta) {
            logger.debug("Sequence metadata {} is stale for store '{}', using {}", fromMeta, name, fromData);
        }
        return Math.max(fromMeta, fromData);
    }

    private StoredEntry<String> toEntry(CacheKey key, LyricsRow row, String text) {
        Map<String, Object> meta = row.metadata() == null ? Map.of() : row.metadata();
        return new StoredEntry<>(key, text, meta,
                Instant.ofEpochMilli(row.createdAt()), Instant.ofEpochMilli(row.accessedAt()),
                row.compression(), row.language(), null);
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Store is closed: " + name);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Persists the insertion sequence and releases RocksDB resources. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed store '{}'", name);
            return;
        }
        logger.info("Closing lyrics store '{}'", name);
        synchronized (writeLock) {
            try {
                byte[] buf = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(sequence.get()).array();
                db.put(writeOpts, META_SEQUENCE_KEY.getBytes(StandardCharsets.UTF_8), buf);
            } catch (RocksDBException e) {
                logger.warn("Failed to persist insertion sequence for store '{}': {}", name, e.getMessage(), e);
            }
            try {
                sequence.close();
            } catch (IOException e) {
                logger.warn("Failed to close insertion sequence for store '{}': {}", name, e.getMessage(), e);
            }
            writeOpts.close();
            db.close();
        }
        logger.info("Closed lyrics store '{}'", name);
    }
}
