package dev.lyricscache.model;

import java.util.List;

/**
 * One character (or character group) of a vocabulary item with its syllables.
 */
public record VocabularyPart(String kanji, List<String> romaji) {
    public VocabularyPart {
        romaji = romaji == null ? List.of() : List.copyOf(romaji);
    }
}
