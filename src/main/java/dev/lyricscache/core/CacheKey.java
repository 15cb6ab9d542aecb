package dev.lyricscache.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a cached artifact: a required primary identifier (song title) and an optional
 * secondary identifier (artist).
 *
 * <p>Both parts are trimmed and lower-cased with {@link Locale#ROOT}. A blank secondary is
 * the same as an absent one. Equality and hashing use only the normalized parts, so
 * {@code CacheKey.of("Lemon ", "KENSHI yonezu")} equals {@code CacheKey.of("lemon", "kenshi yonezu")}.
 * An absent secondary never equals any named secondary, including {@code "unknown"}.
 *
 * <p>The spelling the caller used is kept for display and for the metadata written with an entry.
 */
public final class CacheKey {
    private final String primary;
    private final String secondary;
    private final String displayPrimary;
    private final String displaySecondary;

    private CacheKey(String primary, String secondary, String displayPrimary, String displaySecondary) {
        this.primary = primary;
        this.secondary = secondary;
        this.displayPrimary = displayPrimary;
        this.displaySecondary = displaySecondary;
    }

    /**
     * Creates a normalized key.
     *
     * @param primary   song title, must not be null or blank
     * @param secondary artist, may be null or blank for "no artist"
     * @throws IllegalArgumentException if primary is null or blank
     */
    public static CacheKey of(String primary, String secondary) {
        if (primary == null || primary.trim().isEmpty()) {
            throw new IllegalArgumentException("primary identifier cannot be null or blank");
        }
        String displayPrimary = primary.trim();
        String displaySecondary = (secondary == null || secondary.trim().isEmpty()) ? null : secondary.trim();
        return new CacheKey(
                fold(displayPrimary),
                displaySecondary == null ? null : fold(displaySecondary),
                displayPrimary,
                displaySecondary);
    }

    public static CacheKey of(String primary) {
        return of(primary, null);
    }

    private static String fold(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a key whose display spelling is the normalized spelling.
     */
    public CacheKey normalized() {
        return new CacheKey(primary, secondary, primary, secondary);
    }

    public String primary() {
        return primary;
    }

    /**
     * @return the normalized secondary identifier, or null when absent
     */
    public String secondary() {
        return secondary;
    }

    public boolean hasSecondary() {
        return secondary != null;
    }

    public String displayPrimary() {
        return displayPrimary;
    }

    public String displaySecondary() {
        return displaySecondary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        CacheKey other = (CacheKey) o;
        return primary.equals(other.primary) && Objects.equals(secondary, other.secondary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primary, secondary);
    }

    @Override
    public String toString() {
        return secondary == null ? primary : primary + " / " + secondary;
    }
}
