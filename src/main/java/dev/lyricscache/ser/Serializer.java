package dev.lyricscache.ser;

/**
 * Converts one stored value type to and from the bytes kept in RocksDB.
 *
 * @param <T> value type, fixed per instance
 */
public interface Serializer<T> {
    byte[] encode(T value);

    /**
     * @throws dev.lyricscache.core.CacheStoreException if the bytes are not a valid {@code T}
     */
    T decode(byte[] bytes);
}
