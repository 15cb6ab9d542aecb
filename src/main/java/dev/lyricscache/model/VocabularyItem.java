package dev.lyricscache.model;

import java.util.List;

public record VocabularyItem(String kanji, String romaji, String english, List<VocabularyPart> parts) {
    public VocabularyItem {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }
}
