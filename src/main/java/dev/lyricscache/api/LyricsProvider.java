package dev.lyricscache.api;

import java.io.IOException;
import java.util.Optional;

/**
 * External source of raw lyrics. Only invoked on a cache miss; calls block and have no timeout.
 */
public interface LyricsProvider {
    /**
     * @param song   title as the caller spelled it
     * @param artist artist as the caller spelled it, or null
     * @return the lyrics, or empty when the provider found nothing
     * @throws IOException on network or rate-limit failures
     */
    Optional<FetchedLyrics> fetch(String song, String artist) throws IOException;
}
