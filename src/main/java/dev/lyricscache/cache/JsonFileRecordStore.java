package dev.lyricscache.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.lyricscache.api.CacheListing;
import dev.lyricscache.api.ContentCache;
import dev.lyricscache.api.ListingSource;
import dev.lyricscache.api.StoredEntry;
import dev.lyricscache.config.CacheConfig;
import dev.lyricscache.core.CacheKey;
import dev.lyricscache.core.CacheStoreException;
import dev.lyricscache.core.StorageIds;
import dev.lyricscache.ser.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Derived-record cache: one JSON file per key in a single directory.
 *
 * <p>A file is named {@code {storageId}.json} (see {@link StorageIds}) and holds the payload's JSON
 * object with an embedded {@code _cache_metadata} block:
 * <pre>{@code
 * {
 *   "vocabulary": [ ... ],
 *   "_cache_metadata": {
 *     "song": "Lemon", "artist": "Kenshi Yonezu",
 *     "cachedAt": "2026-01-01T00:00:00Z", "lastAccessed": "2026-01-02T00:00:00Z",
 *     "sequence": 17, "version": "1.0"
 *   }
 * }
 * }</pre>
 * Every write goes to a temp file in the same directory and is then moved over the target, so a
 * reader sees the old or the new file, never a partial one. Last access is an explicit field;
 * reading a record rewrites it with a new {@code lastAccessed} and the same payload. Overwriting a
 * record keeps its {@code cachedAt} and {@code sequence}; the sequence orders records written
 * within the same instant.
 *
 * <p>The directory is created on first write. Until then the store behaves as empty.
 *
 * @param <V> payload type; must serialize to a JSON object
 */
public class JsonFileRecordStore<V> implements ContentCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileRecordStore.class);

    public static final String METADATA_FIELD = "_cache_metadata";
    public static final String FORMAT_VERSION = "1.0";
    static final String EXTENSION = ".json";
    private static final String TEMP_PREFIX = ".tmp-";
    private static final String UNKNOWN = "unknown";

    private final String name;
    private final Path dir;
    private final Class<V> type;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Object writeLock = new Object();
    private long lastSequence = -1L;    // guarded by writeLock, -1 until seeded from disk

    /**
     * Parsed view of one record file used by listing and eviction.
     */
    private record RecordRef(Path file, String song, String artist, Instant cachedAt, Instant lastAccessed,
                             long sequence, long size, ListingSource source) {
    }

    private static final Comparator<RecordRef> LRU_ORDER = Comparator
            .comparing(RecordRef::lastAccessed)
            .thenComparingLong(RecordRef::sequence)
            .thenComparing(r -> r.file().getFileName().toString());

    public JsonFileRecordStore(CacheConfig config, Class<V> type) {
        this(config, type, null);
    }

    public JsonFileRecordStore(CacheConfig config, Class<V> type, Clock clock) {
        this(Paths.get(config.getBasePath(), config.getVocabularyStoreName()), type,
                JsonSerializer.defaultMapper(), clock);
    }

    /**
     * @param dir    directory holding the record files
     * @param type   payload class
     * @param mapper Jackson mapper for payloads
     * @param clock  time source, null for system UTC
     */
    public JsonFileRecordStore(Path dir, Class<V> type, ObjectMapper mapper, Clock clock) {
        this.dir = Objects.requireNonNull(dir, "dir cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.name = dir.getFileName() == null ? dir.toString() : dir.getFileName().toString();
    }

    @Override
    public String name() {
        return name;
    }

    public Path directory() {
        return dir;
    }

    /**
     * Location of the record for {@code key}, whether or not it exists.
     */
    public Path pathFor(CacheKey key) {
        return dir.resolve(StorageIds.storageId(key) + EXTENSION);
    }

    @Override
    public Optional<StoredEntry<V>> get(CacheKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        Path file = pathFor(key);

        MDC.put("cacheStore", name);
        MDC.put("cacheKey", key.toString());
        try {
            synchronized (writeLock) {
                if (!Files.exists(file)) {
                    logger.debug("Cache miss for '{}'", key);
                    return Optional.empty();
                }
                ObjectNode node = readObject(file);
                JsonNode metaNode = node.remove(METADATA_FIELD);
                ObjectNode meta = metaNode instanceof ObjectNode ? (ObjectNode) metaNode : mapper.createObjectNode();
                V value = mapper.treeToValue(node, type);

                Instant now = clock.instant();
                meta.put("lastAccessed", now.toString());
                node.set(METADATA_FIELD, meta);
                writeAtomically(file, node);

                logger.info("Retrieved record from cache: {}", file);
                Instant cachedAt = parseInstant(meta.path("cachedAt").asText(null), now);
                return Optional.of(new StoredEntry<>(key, value, extraOf(meta), cachedAt, now,
                        null, null, file.toString()));
            }
        } catch (NoSuchFileException e) {
            logger.debug("Record for '{}' disappeared before it could be read", key);
            return Optional.empty();
        } catch (IOException e) {
            logger.error("Failed to read record {} for '{}': {}", file, key, e.getMessage(), e);
            throw new CacheStoreException("Failed to read record for key=" + key + " at " + file, e);
        } finally {
            MDC.remove("cacheKey");
            MDC.remove("cacheStore");
        }
    }

    @Override
    public StoredEntry<V> put(CacheKey key, V value, Map<String, Object> metadata) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        JsonNode tree = mapper.valueToTree(value);
        if (!(tree instanceof ObjectNode)) {
            throw new IllegalArgumentException("Record payload must serialize to a JSON object, got "
                    + tree.getNodeType());
        }
        ObjectNode node = (ObjectNode) tree;
        Path file = pathFor(key);

        MDC.put("cacheStore", name);
        MDC.put("cacheKey", key.toString());
        try {
            synchronized (writeLock) {
                Instant now = clock.instant();
                JsonNode previous = existingMetadata(file);
                Instant cachedAt = parseInstant(previous.path("cachedAt").asText(null), now);
                long previousSeq = previous.path("sequence").asLong(0L);
                long seq = previousSeq > 0 ? previousSeq : nextSequence();

                ObjectNode meta = mapper.createObjectNode();
                meta.put("song", key.displayPrimary());
                meta.put("artist", key.displaySecondary());
                meta.put("cachedAt", cachedAt.toString());
                meta.put("lastAccessed", now.toString());
                meta.put("sequence", seq);
                meta.put("version", FORMAT_VERSION);
                if (metadata != null && !metadata.isEmpty()) {
                    meta.set("extra", mapper.valueToTree(metadata));
                }
                node.set(METADATA_FIELD, meta);

                Files.createDirectories(dir);
                writeAtomically(file, node);
                logger.info("Saved record to cache: {}", file);
                return new StoredEntry<>(key, value, metadata == null ? Map.of() : new LinkedHashMap<>(metadata),
                        cachedAt, now, null, null, file.toString());
            }
        } catch (IOException e) {
            logger.error("Failed to save record {} for '{}': {}", file, key, e.getMessage(), e);
            throw new CacheStoreException("Failed to save record for key=" + key + " at " + file, e);
        } finally {
            MDC.remove("cacheKey");
            MDC.remove("cacheStore");
        }
    }

    @Override
    public List<CacheListing> list() {
        List<RecordRef> refs = scan();
        refs.sort(LRU_ORDER.reversed());
        List<CacheListing> listings = new ArrayList<>(refs.size());
        for (RecordRef ref : refs) {
            listings.add(new CacheListing(ref.song(), ref.artist(), ref.cachedAt(), ref.lastAccessed(),
                    ref.size(), ref.file().toString(), ref.source()));
        }
        return listings;
    }

    @Override
    public boolean delete(CacheKey key) {
        Path file = pathFor(key);
        synchronized (writeLock) {
            try {
                boolean deleted = Files.deleteIfExists(file);
                if (deleted) {
                    logger.info("Deleted record {} for '{}'", file, key);
                }
                return deleted;
            } catch (IOException e) {
                logger.error("Failed to delete record {}: {}", file, e.getMessage(), e);
                throw new CacheStoreException("Failed to delete record at " + file, e);
            }
        }
    }

    @Override
    public long count() {
        return recordFiles().size();
    }

    @Override
    public long totalBytes() {
        long total = 0;
        for (Path file : recordFiles()) {
            try {
                total += Files.size(file);
            } catch (NoSuchFileException e) {
                logger.trace("Record {} deleted before it could be sized", file);
            } catch (IOException e) {
                throw new CacheStoreException("Failed to stat record " + file, e);
            }
        }
        return total;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff cannot be null");
        synchronized (writeLock) {
            int deleted = 0;
            for (RecordRef ref : scan()) {
                if (ref.cachedAt().isBefore(cutoff)) {
                    deleteFile(ref.file());
                    deleted++;
                }
            }
            logger.debug("Deleted {} records created before {} from '{}'", deleted, cutoff, name);
            return deleted;
        }
    }

    @Override
    public int deleteLeastRecentlyAccessedExcess(int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount cannot be negative");
        }
        synchronized (writeLock) {
            List<RecordRef> refs = scan();
            int excess = refs.size() - keepCount;
            if (excess <= 0) {
                return 0;
            }
            refs.sort(LRU_ORDER);
            for (RecordRef ref : refs.subList(0, excess)) {
                deleteFile(ref.file());
            }
            logger.debug("Deleted {} least recently accessed records from '{}'", excess, name);
            return excess;
        }
    }

    /**
     * Nothing to release; every operation opens and closes its own file handles.
     */
    @Override
    public void close() {
        logger.debug("Closed record store '{}'", name);
    }

    /**
     * Metadata block of the record currently at {@code file}, or a missing node when there is no
     * readable record.
     */
    private JsonNode existingMetadata(Path file) {
        if (!Files.exists(file)) {
            return mapper.missingNode();
        }
        try {
            return readObject(file).path(METADATA_FIELD);
        } catch (IOException e) {
            logger.warn("Replacing unreadable record {}: {}", file, e.getMessage());
            return mapper.missingNode();
        }
    }

    private long nextSequence() {
        if (lastSequence < 0) {
            long max = 0L;
            for (RecordRef ref : scan()) {
                max = Math.max(max, ref.sequence());
            }
            lastSequence = max;
            logger.debug("Seeded insertion sequence for '{}' at {}", name, max);
        }
        return ++lastSequence;
    }

    private void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.error("Failed to delete record {}: {}", file, e.getMessage(), e);
            throw new CacheStoreException("Failed to delete record at " + file, e);
        }
    }

    private List<Path> recordFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path file : stream) {
                if (!file.getFileName().toString().startsWith(TEMP_PREFIX) && Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            logger.error("Failed to list record directory {}: {}", dir, e.getMessage(), e);
            throw new CacheStoreException("Failed to list record directory " + dir, e);
        }
        return files;
    }

    /**
     * Reads the metadata of every record. A file that cannot be parsed is still returned, with
     * song and artist taken from its name and times from its last-modified time.
     */
    private List<RecordRef> scan() {
        List<RecordRef> refs = new ArrayList<>();
        for (Path file : recordFiles()) {
            long size;
            Instant modified;
            try {
                size = Files.size(file);
                modified = Files.getLastModifiedTime(file).toInstant();
            } catch (NoSuchFileException e) {
                continue;
            } catch (IOException e) {
                throw new CacheStoreException("Failed to stat record " + file, e);
            }
            try {
                JsonNode meta = readObject(file).path(METADATA_FIELD);
                if (!meta.isObject()) {
                    throw new IOException("missing " + METADATA_FIELD + " block");
                }
                Instant cachedAt = parseInstant(meta.path("cachedAt").asText(null), modified);
                Instant lastAccessed = parseInstant(meta.path("lastAccessed").asText(null), cachedAt);
                String artist = meta.path("artist").isTextual() ? meta.path("artist").asText() : null;
                long seq = meta.path("sequence").asLong(0L);
                refs.add(new RecordRef(file, meta.path("song").asText(UNKNOWN), artist, cachedAt, lastAccessed,
                        seq, size, ListingSource.PARSED));
            } catch (NoSuchFileException e) {
                logger.trace("Record {} deleted before it could be read", file);
            } catch (IOException | RuntimeException e) {
                logger.warn("Unreadable record {}, falling back to file name: {}", file, e.getMessage());
                refs.add(fallbackRef(file, size, modified));
            }
        }
        return refs;
    }

    /**
     * Best-effort song and artist from {@code {song}_{artist}_{hash8}.json}. Underscores inside the
     * slugs make this approximate.
     */
    private static RecordRef fallbackRef(Path file, long size, Instant modified) {
        String base = file.getFileName().toString();
        if (base.endsWith(EXTENSION)) {
            base = base.substring(0, base.length() - EXTENSION.length());
        }
        int lastSep = base.lastIndexOf('_');
        if (lastSep > 0 && base.length() - lastSep - 1 == StorageIds.HASH_LENGTH) {
            base = base.substring(0, lastSep);
        }
        String[] parts = base.split("_");
        String song = parts.length > 0 && !parts[0].isEmpty() ? parts[0] : UNKNOWN;
        String artist = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : null;
        return new RecordRef(file, song, artist, modified, modified, 0L, size, ListingSource.FALLBACK_FROM_NAME);
    }

    private ObjectNode readObject(Path file) throws IOException {
        JsonNode node;
        try {
            node = mapper.readTree(Files.readAllBytes(file));
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON in " + file.getFileName() + ": " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode)) {
            throw new IOException("Record " + file.getFileName() + " is not a JSON object");
        }
        return (ObjectNode) node;
    }

    private void writeAtomically(Path target, ObjectNode node) throws IOException {
        Path temp = dir.resolve(TEMP_PREFIX + Long.toHexString(ThreadLocalRandom.current().nextLong()) + ".part");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, node);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Map<String, Object> extraOf(ObjectNode meta) {
        JsonNode extra = meta.get("extra");
        if (extra == null || !extra.isObject()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        extra.fields().forEachRemaining(e -> out.put(e.getKey(), mapper.convertValue(e.getValue(), Object.class)));
        return out;
    }

    private static Instant parseInstant(String text, Instant fallback) {
        if (text == null || text.isEmpty()) {
            return fallback;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
