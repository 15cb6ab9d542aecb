package dev.lyricscache.core;

/**
 * A cache backend could not complete an operation: the store is unavailable, an I/O call failed,
 * or the on-disk state is malformed.
 */
public class CacheStoreException extends RuntimeException {
    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
