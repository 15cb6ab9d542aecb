package dev.lyricscache.api;

import dev.lyricscache.model.Vocabulary;

import java.io.IOException;
import java.util.Optional;

/**
 * External derivation of vocabulary from lyrics. Its output is cached verbatim.
 */
public interface VocabExtractor {
    Optional<Vocabulary> extract(String lyrics) throws IOException;
}
