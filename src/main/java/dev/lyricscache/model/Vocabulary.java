package dev.lyricscache.model;

import java.util.List;

/**
 * Vocabulary derived from one song's lyrics.
 */
public record Vocabulary(List<VocabularyItem> vocabulary) {
    public Vocabulary {
        vocabulary = vocabulary == null ? List.of() : List.copyOf(vocabulary);
    }

    public int size() {
        return vocabulary.size();
    }
}
