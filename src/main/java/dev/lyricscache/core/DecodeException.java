package dev.lyricscache.core;

/**
 * A stored payload is not valid codec output and cannot be turned back into text.
 */
public class DecodeException extends CacheStoreException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
