package dev.lyricscache.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives filesystem-safe storage ids from cache keys.
 *
 * <p>Layout: {@code {song-slug}[_{artist-slug}]_{hash8}} where {@code hash8} is the first eight
 * hex characters of the MD5 of {@code song SEP artist}. An absent artist hashes with a marker that
 * no trimmed string can equal, so "no artist" and any named artist address different ids even
 * when their slugs coincide.
 */
public final class StorageIds {
    private StorageIds() {}

    public static final int HASH_LENGTH = 8;
    static final int MAX_SLUG_LENGTH = 48;

    private static final char SEPARATOR = '\u001f';
    private static final char ABSENT = '\u0000';

    public static String storageId(CacheKey key) {
        String slug = slug(key.primary());
        if (key.hasSecondary()) {
            slug = slug + "_" + slug(key.secondary());
        }
        return slug + "_" + hash(key);
    }

    public static String storageId(String primary, String secondary) {
        return storageId(CacheKey.of(primary, secondary));
    }

    /**
     * Hash component of the storage id for a key.
     */
    public static String hash(CacheKey key) {
        String material = key.primary() + SEPARATOR + (key.hasSecondary() ? key.secondary() : String.valueOf(ABSENT));
        return md5Hex(material).substring(0, HASH_LENGTH);
    }

    /**
     * Lower-cases and replaces every character outside {@code [a-z0-9]} with an underscore.
     */
    public static String slug(String s) {
        String lower = s.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(Math.min(lower.length(), MAX_SLUG_LENGTH));
        for (int i = 0; i < lower.length() && sb.length() < MAX_SLUG_LENGTH; i++) {
            char c = lower.charAt(i);
            sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') ? c : '_');
        }
        return sb.toString();
    }

    private static String md5Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
