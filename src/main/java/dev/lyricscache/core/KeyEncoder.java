package dev.lyricscache.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Encodes normalized cache keys as RocksDB row keys.
 * Layout: [1 byte ROW_PREFIX][4 bytes big-endian primary length][primary UTF-8][1 byte artist flag][artist UTF-8]
 *
 * <p>The explicit flag keeps "no artist" distinct from every artist string. Row keys all start with
 * {@link #ROW_PREFIX}, which sorts before the {@code meta:} keys.
 */
public final class KeyEncoder {
    private KeyEncoder() {}

    public static final byte ROW_PREFIX = 'L';
    private static final byte NO_SECONDARY = 0;
    private static final byte HAS_SECONDARY = 1;
    private static final int MIN_LENGTH = 1 + 4 + 1;

    public static byte[] encode(CacheKey key) {
        byte[] p = key.primary().getBytes(StandardCharsets.UTF_8);
        byte[] s = key.hasSecondary() ? key.secondary().getBytes(StandardCharsets.UTF_8) : new byte[0];
        ByteBuffer buf = ByteBuffer.allocate(MIN_LENGTH + p.length + s.length).order(ByteOrder.BIG_ENDIAN);
        buf.put(ROW_PREFIX);
        buf.putInt(p.length);
        buf.put(p);
        buf.put(key.hasSecondary() ? HAS_SECONDARY : NO_SECONDARY);
        buf.put(s);
        return buf.array();
    }

    public static boolean isRowKey(byte[] key) {
        return key != null && key.length >= MIN_LENGTH && key[0] == ROW_PREFIX;
    }

    public static CacheKey decode(byte[] key) {
        if (!isRowKey(key)) {
            throw new IllegalArgumentException("Not a row key");
        }
        ByteBuffer buf = ByteBuffer.wrap(key).order(ByteOrder.BIG_ENDIAN);
        buf.get();
        int pLen = buf.getInt();
        if (pLen < 0 || pLen > key.length - MIN_LENGTH) {
            throw new IllegalArgumentException("Invalid primary length: " + pLen);
        }
        String primary = new String(key, 5, pLen, StandardCharsets.UTF_8);
        byte flag = key[5 + pLen];
        if (flag == NO_SECONDARY) {
            return CacheKey.of(primary);
        }
        int sStart = 6 + pLen;
        return CacheKey.of(primary, new String(key, sStart, key.length - sStart, StandardCharsets.UTF_8));
    }
}
