package dev.lyricscache.client;

import dev.lyricscache.api.CacheListing;
import dev.lyricscache.api.FetchedLyrics;
import dev.lyricscache.api.LyricsProvider;
import dev.lyricscache.api.VocabExtractor;
import dev.lyricscache.cache.LyricsRow;
import dev.lyricscache.codec.CompressionCodec;
import dev.lyricscache.config.CacheConfig;
import dev.lyricscache.core.CacheKey;
import dev.lyricscache.core.KeyEncoder;
import dev.lyricscache.core.StorageIds;
import dev.lyricscache.eviction.EvictionStats;
import dev.lyricscache.model.Vocabulary;
import dev.lyricscache.model.VocabularyItem;
import dev.lyricscache.ser.JsonSerializer;
import dev.lyricscache.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LyricsCacheClientTest {

    static { RocksDB.loadLibrary(); }

    private static final Instant T0 = Instant.parse("2026-04-01T12:00:00Z");
    private static final String LEMON = "夢ならばどれほどよかったでしょう\n未だにあなたのことを夢にみる\n";

    private Path tmp;
    private LyricsCacheClient client;
    private final MutableClock clock = MutableClock.startingAt(T0);

    static class CountingProvider implements LyricsProvider {
        final AtomicInteger calls = new AtomicInteger();
        volatile String text = LEMON;
        volatile IOException failure;
        volatile CountDownLatch gate;

        @Override
        public Optional<FetchedLyrics> fetch(String song, String artist) throws IOException {
            calls.incrementAndGet();
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) throw failure;
            if (text == null) return Optional.empty();
            return Optional.of(new FetchedLyrics(text, "https://lyrics.example/" + song));
        }
    }

    static class CountingExtractor implements VocabExtractor {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public Optional<Vocabulary> extract(String lyrics) {
            calls.incrementAndGet();
            return Optional.of(new Vocabulary(List.of(
                    new VocabularyItem("夢", "yume", "dream", List.of()))));
        }
    }

    private final CountingProvider provider = new CountingProvider();
    private final CountingExtractor extractor = new CountingExtractor();

    private CacheConfig config() throws IOException {
        if (tmp == null) {
            tmp = Files.createTempDirectory("lyricscache-client-");
        }
        return new CacheConfig().setBasePath(tmp.toString());
    }

    private LyricsCacheClient newClient(CacheConfig cfg) {
        client = new LyricsCacheClient(cfg, provider, extractor, clock);
        return client;
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) client.close();
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a, b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    @Test
    void mockLemonIsServedFromCacheOnSecondCall() throws Exception {
        LyricsCacheClient c = newClient(config());

        LyricsResult first = c.fetchLyrics("Lemon", "Kenshi Yonezu", true);
        assertTrue(first.success());
        assertFalse(first.fromCache());
        assertTrue(first.cacheInfo().mock());
        assertTrue(first.lyrics().contains("Lemon"));
        assertEquals("mock_data", first.metadata().get("source"));
        assertEquals(Boolean.TRUE, first.metadata().get("isMock"));
        assertEquals("Kenshi Yonezu", first.metadata().get("artist"));
        assertEquals(CompressionCodec.METHOD, first.cacheInfo().compression().compressionMethod());
        assertEquals(0, provider.calls.get());

        clock.advance(Duration.ofMinutes(1));
        LyricsResult second = c.fetchLyrics("lemon", "kenshi yonezu", true);
        assertTrue(second.success());
        assertTrue(second.fromCache());
        assertEquals(first.lyrics(), second.lyrics());
        assertEquals(T0, second.cacheInfo().cachedAt());
        assertTrue(second.cacheInfo().mock());
    }

    @Test
    void providerResultIsCachedWithProvenance() throws Exception {
        LyricsCacheClient c = newClient(config());

        LyricsResult miss = c.fetchLyrics("Lemon", "Kenshi Yonezu");
        assertTrue(miss.success());
        assertFalse(miss.fromCache());
        assertEquals(LEMON, miss.lyrics());
        assertEquals("https://lyrics.example/Lemon", miss.metadata().get("source"));
        assertEquals(T0.toString(), miss.metadata().get("fetchedAt"));
        assertEquals("japanese", miss.cacheInfo().language());

        LyricsResult hit = c.fetchLyrics("LEMON ", "Kenshi Yonezu");
        assertTrue(hit.fromCache());
        assertEquals(LEMON, hit.lyrics());
        assertEquals("Lemon", hit.metadata().get("title"));
        assertEquals(1, provider.calls.get());
    }

    @Test
    void emptyProviderResultIsNotFound() throws Exception {
        LyricsCacheClient c = newClient(config());
        provider.text = "   ";
        LyricsResult blank = c.fetchLyrics("Nothing", "Nobody");
        assertFalse(blank.success());
        assertEquals(FetchError.NOT_FOUND, blank.error());

        provider.text = null;
        LyricsResult none = c.fetchLyrics("Nothing", "Nobody");
        assertEquals(FetchError.NOT_FOUND, none.error());
        assertEquals(0, c.listCachedLyrics().count());
    }

    @Test
    void providerFailureIsReportedAndNothingCached() throws Exception {
        LyricsCacheClient c = newClient(config());
        provider.failure = new IOException("connection reset");

        LyricsResult result = c.fetchLyrics("Lemon", "Kenshi Yonezu");
        assertFalse(result.success());
        assertEquals(FetchError.PROVIDER_ERROR, result.error());
        assertTrue(result.errorMessage().contains("connection reset"));
        assertTrue(c.listCachedLyrics().entries().isEmpty());

        provider.failure = null;
        assertTrue(c.fetchLyrics("Lemon", "Kenshi Yonezu").success());
    }

    @Test
    void missingProviderIsProviderError() throws Exception {
        client = new LyricsCacheClient(config(), null, null, clock);
        LyricsResult result = client.fetchLyrics("Lemon", "Kenshi Yonezu");
        assertEquals(FetchError.PROVIDER_ERROR, result.error());
        assertTrue(client.fetchLyrics("Lemon", "Kenshi Yonezu", true).success());
    }

    @Test
    void nullConfigIsRejectedBeforeOpeningStores() {
        NullPointerException e = assertThrows(NullPointerException.class,
                () -> new LyricsCacheClient(null, provider, extractor, clock));
        assertEquals("config", e.getMessage());
    }

    @Test
    void blankSongIsRejected() throws Exception {
        LyricsCacheClient c = newClient(config());
        assertThrows(IllegalArgumentException.class, () -> c.fetchLyrics(" ", "Kenshi Yonezu"));
    }

    @Test
    void distinctArtistsWithSameTitleAreCachedSeparately() throws Exception {
        LyricsCacheClient c = newClient(config());
        provider.text = "first artist lyrics";
        c.fetchLyrics("Lemon", "Kenshi Yonezu");
        provider.text = "second artist lyrics";
        c.fetchLyrics("Lemon", "Someone Else");

        assertEquals("first artist lyrics", c.fetchLyrics("Lemon", "Kenshi Yonezu").lyrics());
        assertEquals("second artist lyrics", c.fetchLyrics("Lemon", "Someone Else").lyrics());
        assertEquals(2, provider.calls.get());
        assertEquals(2, c.listCachedLyrics().count());
    }

    @Test
    void corruptEntryIsRefetchedAndOverwritten() throws Exception {
        CacheConfig cfg = config();
        LyricsCacheClient c = newClient(cfg);
        c.fetchLyrics("Lemon", "Kenshi Yonezu");
        c.close();
        client = null;

        JsonSerializer<LyricsRow> ser = new JsonSerializer<>(LyricsRow.class);
        try (Options options = new Options();
             RocksDB db = RocksDB.open(options, tmp.resolve(cfg.getLyricsStoreName()).toString())) {
            byte[] k = KeyEncoder.encode(CacheKey.of("Lemon", "Kenshi Yonezu"));
            LyricsRow row = ser.decode(db.get(k));
            db.put(k, ser.encode(new LyricsRow(row.song(), row.artist(), "%%%not-base64%%%",
                    row.compression(), row.metadata(), row.language(), row.sourceUrl(),
                    row.createdAt(), row.accessedAt(), row.sequence())));
        }

        LyricsCacheClient reopened = newClient(cfg);
        provider.text = "refetched lyrics";
        LyricsResult result = reopened.fetchLyrics("Lemon", "Kenshi Yonezu");
        assertTrue(result.success());
        assertFalse(result.fromCache());
        assertEquals("refetched lyrics", result.lyrics());
        assertEquals(2, provider.calls.get());

        LyricsResult hit = reopened.fetchLyrics("Lemon", "Kenshi Yonezu");
        assertTrue(hit.fromCache());
        assertEquals("refetched lyrics", hit.lyrics());
    }

    @Test
    void concurrentMissesForSameKeyCallProviderOnce() throws Exception {
        LyricsCacheClient c = newClient(config());
        provider.gate = new CountDownLatch(1);

        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<LyricsResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> c.fetchLyrics("Lemon", "Kenshi Yonezu")));
            }
            Thread.sleep(200);
            provider.gate.countDown();

            int fresh = 0;
            for (Future<LyricsResult> f : futures) {
                LyricsResult r = f.get(10, TimeUnit.SECONDS);
                assertTrue(r.success());
                assertEquals(LEMON, r.lyrics());
                if (!r.fromCache()) fresh++;
            }
            assertEquals(1, fresh);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, provider.calls.get());
    }

    @Test
    void vocabularyIsProbeOnlyUntilSaved() throws Exception {
        LyricsCacheClient c = newClient(config());

        VocabularyResult miss = c.fetchVocabulary("Lemon", "Kenshi Yonezu");
        assertFalse(miss.success());
        assertEquals(FetchError.NOT_FOUND, miss.error());

        Vocabulary vocab = new Vocabulary(List.of(new VocabularyItem("苦い", "nigai", "bitter", List.of())));
        VocabularyResult saved = c.saveVocabulary("Lemon", "Kenshi Yonezu", vocab);
        assertTrue(saved.success());
        assertFalse(saved.fromCache());
        assertTrue(saved.cacheInfo().location().endsWith(
                StorageIds.storageId("Lemon", "Kenshi Yonezu") + ".json"));

        VocabularyResult hit = c.fetchVocabulary("lemon", "KENSHI YONEZU");
        assertTrue(hit.success());
        assertTrue(hit.fromCache());
        assertEquals(vocab, hit.vocabulary());
        assertEquals(0, extractor.calls.get());
    }

    @Test
    void deriveVocabularyReadsThroughLyricsAndCaches() throws Exception {
        LyricsCacheClient c = newClient(config());

        VocabularyResult first = c.deriveVocabulary("Lemon", "Kenshi Yonezu");
        assertTrue(first.success());
        assertFalse(first.fromCache());
        assertEquals(1, first.vocabulary().size());

        VocabularyResult second = c.deriveVocabulary("Lemon", "Kenshi Yonezu");
        assertTrue(second.fromCache());
        assertEquals(1, extractor.calls.get());
        assertEquals(1, provider.calls.get());
        assertTrue(c.fetchLyrics("Lemon", "Kenshi Yonezu").fromCache());
    }

    @Test
    void deriveVocabularyPropagatesLyricsFailure() throws Exception {
        LyricsCacheClient c = newClient(config());
        provider.text = null;
        VocabularyResult result = c.deriveVocabulary("Unknown Song", null);
        assertFalse(result.success());
        assertEquals(FetchError.NOT_FOUND, result.error());
        assertEquals(0, extractor.calls.get());
    }

    @Test
    void listingsReportBothCaches() throws Exception {
        LyricsCacheClient c = newClient(config());
        c.fetchLyrics("Lemon", "Kenshi Yonezu", true);
        clock.advance(Duration.ofSeconds(1));
        c.fetchLyrics("Uma to Shika", null, true);
        clock.advance(Duration.ofSeconds(1));
        c.deriveVocabulary("Lemon", "Kenshi Yonezu", true);

        ListingResult lyrics = c.listCachedLyrics();
        assertTrue(lyrics.success());
        assertEquals(2, lyrics.count());
        CacheListing newest = lyrics.entries().get(0);
        assertEquals("lemon", newest.song());

        ListingResult vocab = c.listCachedVocabulary();
        assertEquals(1, vocab.count());
        assertEquals("Lemon", vocab.entries().get(0).song());
        assertEquals("Kenshi Yonezu", vocab.entries().get(0).artist());
    }

    @Test
    void evictionThroughClient() throws Exception {
        LyricsCacheClient c = newClient(config());
        clock.set(T0.minus(Duration.ofDays(100)));
        c.fetchLyrics("Old", "Artist", true);
        c.saveVocabulary("Old", "Artist", new Vocabulary(List.of()));
        clock.set(T0);
        c.fetchLyrics("New", "Artist", true);
        c.saveVocabulary("New", "Artist", new Vocabulary(List.of()));

        EvictionStats lyricsStats = c.evictLyricsCache(10, 30);
        assertTrue(lyricsStats.success());
        assertEquals(1, lyricsStats.deletedOld());
        assertEquals(1, lyricsStats.finalCount());

        EvictionStats vocabStats = c.evictVocabularyCache();
        assertEquals(1, vocabStats.deletedOld());
        assertEquals(1, vocabStats.finalCount());

        assertThrows(IllegalArgumentException.class, () -> c.evictLyricsCache(-1, 1));
    }

    @Test
    void deleteHelpersRemoveEntries() throws Exception {
        LyricsCacheClient c = newClient(config());
        c.fetchLyrics("Lemon", "Kenshi Yonezu", true);
        c.saveVocabulary("Lemon", "Kenshi Yonezu", new Vocabulary(List.of()));

        assertTrue(c.deleteLyrics("lemon", "kenshi yonezu"));
        assertTrue(c.deleteVocabulary("Lemon", "Kenshi Yonezu"));
        assertFalse(c.fetchLyrics("Lemon", "Kenshi Yonezu", true).fromCache());
        assertFalse(c.fetchVocabulary("Lemon", "Kenshi Yonezu").success());
    }

    @Test
    void uncoalescedMissesStillSucceed() throws Exception {
        LyricsCacheClient c = newClient(config().setCoalesceMisses(false));
        assertFalse(c.fetchLyrics("Lemon", "Kenshi Yonezu").fromCache());
        assertTrue(c.fetchLyrics("Lemon", "Kenshi Yonezu").fromCache());
        assertEquals(1, provider.calls.get());
    }
}
