package dev.lyricscache.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    void normalizesCaseAndWhitespace() {
        CacheKey a = CacheKey.of("  Lemon ", "KENSHI Yonezu");
        CacheKey b = CacheKey.of("lemon", "kenshi yonezu");

        assertEquals("lemon", a.primary());
        assertEquals("kenshi yonezu", a.secondary());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void keepsDisplaySpelling() {
        CacheKey key = CacheKey.of(" Lemon ", " Kenshi Yonezu ");
        assertEquals("Lemon", key.displayPrimary());
        assertEquals("Kenshi Yonezu", key.displaySecondary());

        CacheKey normalized = key.normalized();
        assertEquals("lemon", normalized.displayPrimary());
        assertEquals(key, normalized);
    }

    @Test
    void normalizationIsIdempotent() {
        CacheKey once = CacheKey.of("Ｍixed Case Ä", "Ärtist");
        CacheKey twice = CacheKey.of(once.primary(), once.secondary());
        assertEquals(once.primary(), twice.primary());
        assertEquals(once.secondary(), twice.secondary());
    }

    @Test
    void blankSecondaryIsAbsent() {
        CacheKey none = CacheKey.of("Lemon", null);
        CacheKey blank = CacheKey.of("Lemon", "   ");

        assertFalse(none.hasSecondary());
        assertNull(blank.secondary());
        assertEquals(none, blank);
        assertEquals(none, CacheKey.of("Lemon"));
        assertEquals("lemon", none.toString());
    }

    @Test
    void absentSecondaryNeverEqualsNamedOne() {
        assertNotEquals(CacheKey.of("Lemon"), CacheKey.of("Lemon", "unknown"));
        assertNotEquals(CacheKey.of("Lemon", "Kenshi Yonezu"), CacheKey.of("Lemon", "Someone Else"));
    }

    @Test
    void rejectsBlankPrimary() {
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of(null, "a"));
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of("  ", "a"));
        assertThrows(IllegalArgumentException.class, () -> CacheKey.of(""));
    }
}
