package dev.lyricscache.client;

import dev.lyricscache.model.Vocabulary;

public record VocabularyResult(
        boolean success,
        Vocabulary vocabulary,
        CacheInfo cacheInfo,
        FetchError error,
        String errorMessage
) {
    static VocabularyResult success(Vocabulary vocabulary, CacheInfo cacheInfo) {
        return new VocabularyResult(true, vocabulary, cacheInfo, null, null);
    }

    static VocabularyResult failure(FetchError error, String message) {
        return new VocabularyResult(false, null, null, error, message);
    }

    public boolean fromCache() {
        return cacheInfo != null && cacheInfo.fromCache();
    }
}
