package dev.lyricscache.api;

/**
 * Lyrics returned by a {@link LyricsProvider}.
 *
 * @param text      raw lyrics
 * @param sourceUrl where the text was found, may be empty
 */
public record FetchedLyrics(String text, String sourceUrl) {
}
