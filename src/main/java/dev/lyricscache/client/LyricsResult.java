package dev.lyricscache.client;

import java.util.Map;

public record LyricsResult(
        boolean success,
        String lyrics,
        Map<String, Object> metadata,
        CacheInfo cacheInfo,
        FetchError error,
        String errorMessage
) {
    static LyricsResult success(String lyrics, Map<String, Object> metadata, CacheInfo cacheInfo) {
        return new LyricsResult(true, lyrics, metadata, cacheInfo, null, null);
    }

    static LyricsResult failure(FetchError error, String message) {
        return new LyricsResult(false, null, null, null, error, message);
    }

    public boolean fromCache() {
        return cacheInfo != null && cacheInfo.fromCache();
    }
}
