package dev.lyricscache.api;

/**
 * Where the fields of a {@link CacheListing} came from.
 */
public enum ListingSource {
    /** Parsed from the stored entry. */
    PARSED,
    /** The record file could not be parsed; song and artist were recovered from its file name. */
    FALLBACK_FROM_NAME,
    /** The RocksDB row could not be parsed; song and artist were recovered from its row key. */
    FALLBACK_FROM_KEY
}
