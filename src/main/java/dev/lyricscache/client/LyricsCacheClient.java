package dev.lyricscache.client;

import dev.lyricscache.api.ContentCache;
import dev.lyricscache.api.FetchedLyrics;
import dev.lyricscache.api.LyricsProvider;
import dev.lyricscache.api.StoredEntry;
import dev.lyricscache.api.VocabExtractor;
import dev.lyricscache.cache.JsonFileRecordStore;
import dev.lyricscache.cache.RocksLyricsStore;
import dev.lyricscache.codec.CompressionStats;
import dev.lyricscache.config.CacheConfig;
import dev.lyricscache.core.CacheKey;
import dev.lyricscache.core.CacheStoreException;
import dev.lyricscache.core.KeyedLocks;
import dev.lyricscache.core.LanguageHint;
import dev.lyricscache.eviction.EvictionManager;
import dev.lyricscache.eviction.EvictionStats;
import dev.lyricscache.model.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-through entry point for lyrics and vocabulary.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setBasePath("/var/lib/lyrics-cache");
 * try (LyricsCacheClient client = new LyricsCacheClient(config, provider, extractor)) {
 *     LyricsResult lyrics = client.fetchLyrics("Lemon", "Kenshi Yonezu");
 *     if (lyrics.success() && lyrics.fromCache()) { ... }
 *
 *     VocabularyResult vocab = client.deriveVocabulary("Lemon", "Kenshi Yonezu");
 *     EvictionStats stats = client.evictLyricsCache(500, 60);
 * }
 * }</pre>
 *
 * <p>Failure policy: every fetch method returns a result object and never throws for collaborator or
 * cache failures. A cache read that fails is logged and handled as a miss. A cache write that fails
 * is logged and the fresh value is still returned.
 *
 * <p>Concurrent misses for the same normalized key are coalesced when
 * {@link CacheConfig#isCoalesceMisses()} is set: one caller fetches, the others wait and then read
 * the entry it stored. With coalescing off, concurrent misses each call the collaborator and the
 * last write wins.
 */
public class LyricsCacheClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LyricsCacheClient.class);

    private final ContentCache<String> lyricsCache;
    private final ContentCache<Vocabulary> vocabularyCache;
    private final LyricsProvider lyricsProvider;
    private final VocabExtractor vocabExtractor;
    private final EvictionManager evictionManager;
    private final CacheConfig config;
    private final Clock clock;
    private final KeyedLocks<CacheKey> lyricsLocks = new KeyedLocks<>();
    private final KeyedLocks<CacheKey> vocabularyLocks = new KeyedLocks<>();

    /**
     * Opens a RocksDB lyrics store and a JSON record vocabulary store under
     * {@link CacheConfig#getBasePath()}.
     *
     * @param lyricsProvider used on lyrics misses; may be null when only mock fetches are made
     * @param vocabExtractor used by {@link #deriveVocabulary}; may be null
     */
    public LyricsCacheClient(CacheConfig config, LyricsProvider lyricsProvider, VocabExtractor vocabExtractor) {
        this(config, lyricsProvider, vocabExtractor, null);
    }

    public LyricsCacheClient(CacheConfig config, LyricsProvider lyricsProvider, VocabExtractor vocabExtractor,
                             Clock clock) {
        this(config,
                new RocksLyricsStore(Objects.requireNonNull(config, "config"), clock),
                new JsonFileRecordStore<>(config, Vocabulary.class, clock),
                lyricsProvider, vocabExtractor, new EvictionManager(clock), clock);
    }

    /**
     * Wires explicit backends; the client takes ownership and closes them on {@link #close()}.
     */
    public LyricsCacheClient(CacheConfig config,
                             ContentCache<String> lyricsCache,
                             ContentCache<Vocabulary> vocabularyCache,
                             LyricsProvider lyricsProvider,
                             VocabExtractor vocabExtractor,
                             EvictionManager evictionManager,
                             Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.lyricsCache = Objects.requireNonNull(lyricsCache, "lyricsCache");
        this.vocabularyCache = Objects.requireNonNull(vocabularyCache, "vocabularyCache");
        this.evictionManager = Objects.requireNonNull(evictionManager, "evictionManager");
        this.lyricsProvider = lyricsProvider;
        this.vocabExtractor = vocabExtractor;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    public LyricsResult fetchLyrics(String song, String artist) {
        return fetchLyrics(song, artist, false);
    }

    /**
     * Returns cached lyrics, or fetches, stores and returns them.
     *
     * @param allowMock on a miss, store and return deterministic placeholder lyrics instead of
     *                  calling the provider
     * @throws IllegalArgumentException if song is null or blank
     */
    public LyricsResult fetchLyrics(String song, String artist, boolean allowMock) {
        CacheKey key = CacheKey.of(song, artist);
        Optional<LyricsResult> cached = probeLyrics(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        logger.info("Cache miss for '{}', {}", key, allowMock ? "using mock data" : "fetching from provider");
        if (!config.isCoalesceMisses()) {
            return loadLyrics(key, allowMock);
        }
        return lyricsLocks.withLock(key, () -> probeLyrics(key).orElseGet(() -> loadLyrics(key, allowMock)));
    }

    private Optional<LyricsResult> probeLyrics(CacheKey key) {
        Optional<StoredEntry<String>> hit;
        try {
            hit = lyricsCache.get(key);
        } catch (CacheStoreException e) {
            logger.warn("Lyrics cache read failed for '{}', treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        return hit.map(entry -> LyricsResult.success(entry.value(), entry.metadata(),
                new CacheInfo(true, entry.createdAt(), entry.compression(), entry.language(), null,
                        Boolean.TRUE.equals(entry.metadata().get("isMock")))));
    }

    private LyricsResult loadLyrics(CacheKey key, boolean allowMock) {
        String lyrics;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", key.displayPrimary());
        metadata.put("artist", key.displaySecondary() == null ? "Unknown" : key.displaySecondary());

        if (allowMock) {
            lyrics = MockLyrics.render(key.displayPrimary(), key.displaySecondary());
            metadata.put("source", MockLyrics.SOURCE);
            metadata.put("fetchedAt", clock.instant().toString());
            metadata.put("isMock", true);
        } else {
            if (lyricsProvider == null) {
                return LyricsResult.failure(FetchError.PROVIDER_ERROR, "No lyrics provider configured");
            }
            Optional<FetchedLyrics> fetched;
            try {
                fetched = lyricsProvider.fetch(key.displayPrimary(), key.displaySecondary());
            } catch (IOException | RuntimeException e) {
                logger.error("Error fetching lyrics for '{}': {}", key, e.getMessage(), e);
                return LyricsResult.failure(FetchError.PROVIDER_ERROR, "Error fetching lyrics: " + e.getMessage());
            }
            if (fetched == null || fetched.isEmpty() || isBlank(fetched.get().text())) {
                logger.info("No lyrics found for '{}'", key);
                return LyricsResult.failure(FetchError.NOT_FOUND, "No lyrics found for the given song and artist");
            }
            lyrics = fetched.get().text();
            metadata.put("source", fetched.get().sourceUrl() == null ? "" : fetched.get().sourceUrl());
            metadata.put("fetchedAt", clock.instant().toString());
        }

        String language = LanguageHint.detect(lyrics);
        CompressionStats compression = null;
        Instant cachedAt = null;
        try {
            StoredEntry<String> stored = lyricsCache.put(key, lyrics, metadata);
            compression = stored.compression();
            cachedAt = stored.createdAt();
        } catch (CacheStoreException e) {
            logger.warn("Failed to cache lyrics for '{}', returning uncached result: {}", key, e.getMessage());
        }
        return LyricsResult.success(lyrics, metadata,
                new CacheInfo(false, cachedAt, compression, language, null, allowMock));
    }

    /**
     * Cache probe only; derivation belongs to the {@link VocabExtractor}.
     *
     * @return the cached vocabulary, or a {@link FetchError#NOT_FOUND} failure on a miss
     */
    public VocabularyResult fetchVocabulary(String song, String artist) {
        CacheKey key = CacheKey.of(song, artist);
        return probeVocabulary(key).orElseGet(() ->
                VocabularyResult.failure(FetchError.NOT_FOUND, "No cached vocabulary for " + key));
    }

    private Optional<VocabularyResult> probeVocabulary(CacheKey key) {
        Optional<StoredEntry<Vocabulary>> hit;
        try {
            hit = vocabularyCache.get(key);
        } catch (CacheStoreException e) {
            logger.warn("Vocabulary cache read failed for '{}', treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        return hit.map(entry -> VocabularyResult.success(entry.value(),
                new CacheInfo(true, entry.createdAt(), null, null, entry.location(), false)));
    }

    /**
     * Stores vocabulary produced outside this client.
     */
    public VocabularyResult saveVocabulary(String song, String artist, Vocabulary vocabulary) {
        CacheKey key = CacheKey.of(song, artist);
        Objects.requireNonNull(vocabulary, "vocabulary");
        try {
            StoredEntry<Vocabulary> stored = vocabularyCache.put(key, vocabulary, Map.of());
            return VocabularyResult.success(vocabulary,
                    new CacheInfo(false, stored.createdAt(), null, null, stored.location(), false));
        } catch (CacheStoreException e) {
            logger.error("Error saving vocabulary for '{}': {}", key, e.getMessage(), e);
            return VocabularyResult.failure(FetchError.STORE_ERROR, e.getMessage());
        }
    }

    public VocabularyResult deriveVocabulary(String song, String artist) {
        return deriveVocabulary(song, artist, false);
    }

    /**
     * Returns cached vocabulary, or fetches lyrics (read-through), extracts vocabulary, stores and
     * returns it.
     */
    public VocabularyResult deriveVocabulary(String song, String artist, boolean allowMock) {
        CacheKey key = CacheKey.of(song, artist);
        Optional<VocabularyResult> cached = probeVocabulary(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!config.isCoalesceMisses()) {
            return loadVocabulary(key, allowMock);
        }
        return vocabularyLocks.withLock(key,
                () -> probeVocabulary(key).orElseGet(() -> loadVocabulary(key, allowMock)));
    }

    private VocabularyResult loadVocabulary(CacheKey key, boolean allowMock) {
        LyricsResult lyrics = fetchLyrics(key.displayPrimary(), key.displaySecondary(), allowMock);
        if (!lyrics.success()) {
            return VocabularyResult.failure(lyrics.error(), lyrics.errorMessage());
        }
        if (vocabExtractor == null) {
            return VocabularyResult.failure(FetchError.PROVIDER_ERROR, "No vocabulary extractor configured");
        }

        Optional<Vocabulary> extracted;
        try {
            extracted = vocabExtractor.extract(lyrics.lyrics());
        } catch (IOException | RuntimeException e) {
            logger.error("Error extracting vocabulary for '{}': {}", key, e.getMessage(), e);
            return VocabularyResult.failure(FetchError.PROVIDER_ERROR, "Error extracting vocabulary: " + e.getMessage());
        }
        if (extracted == null || extracted.isEmpty()) {
            return VocabularyResult.failure(FetchError.NOT_FOUND, "No vocabulary extracted for " + key);
        }

        Vocabulary vocabulary = extracted.get();
        try {
            StoredEntry<Vocabulary> stored = vocabularyCache.put(key, vocabulary, Map.of());
            return VocabularyResult.success(vocabulary,
                    new CacheInfo(false, stored.createdAt(), null, null, stored.location(), allowMock));
        } catch (CacheStoreException e) {
            logger.warn("Failed to cache vocabulary for '{}', returning uncached result: {}", key, e.getMessage());
            return VocabularyResult.success(vocabulary, new CacheInfo(false, null, null, null, null, allowMock));
        }
    }

    public ListingResult listCachedLyrics() {
        return list(lyricsCache);
    }

    public ListingResult listCachedVocabulary() {
        return list(vocabularyCache);
    }

    private ListingResult list(ContentCache<?> cache) {
        try {
            return ListingResult.of(cache.list());
        } catch (CacheStoreException e) {
            logger.error("Error listing cache '{}': {}", cache.name(), e.getMessage(), e);
            return ListingResult.failure("Error listing cache " + cache.name() + ": " + e.getMessage());
        }
    }

    public EvictionStats evictLyricsCache() {
        return evictLyricsCache(config.getDefaultMaxEntries(), config.getDefaultMaxAgeDays());
    }

    public EvictionStats evictLyricsCache(int maxEntries, int maxAgeDays) {
        return evict(lyricsCache, maxEntries, maxAgeDays);
    }

    public EvictionStats evictVocabularyCache() {
        return evictVocabularyCache(config.getDefaultMaxEntries(), config.getDefaultMaxAgeDays());
    }

    public EvictionStats evictVocabularyCache(int maxEntries, int maxAgeDays) {
        return evict(vocabularyCache, maxEntries, maxAgeDays);
    }

    private EvictionStats evict(ContentCache<?> cache, int maxEntries, int maxAgeDays) {
        try {
            return evictionManager.evict(cache, maxEntries, maxAgeDays);
        } catch (CacheStoreException e) {
            logger.error("Error cleaning cache '{}': {}", cache.name(), e.getMessage(), e);
            return EvictionStats.failure("Error cleaning cache " + cache.name() + ": " + e.getMessage());
        }
    }

    /**
     * Administrative removal of one lyrics entry.
     *
     * @return true if an entry was removed
     */
    public boolean deleteLyrics(String song, String artist) {
        return lyricsCache.delete(CacheKey.of(song, artist));
    }

    public boolean deleteVocabulary(String song, String artist) {
        return vocabularyCache.delete(CacheKey.of(song, artist));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    public void close() {
        try {
            lyricsCache.close();
        } finally {
            vocabularyCache.close();
        }
    }
}
