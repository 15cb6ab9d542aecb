package dev.lyricscache.core;

/**
 * Coarse script detection stored as entry metadata. It never changes cache behavior.
 * Text containing any ASCII letter is tagged {@code english}, everything else {@code japanese};
 * mixed-script lyrics are therefore tagged {@code english}.
 */
public final class LanguageHint {
    private LanguageHint() {}

    public static final String ENGLISH = "english";
    public static final String JAPANESE = "japanese";

    public static String detect(String text) {
        if (text != null) {
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                    return ENGLISH;
                }
            }
        }
        return JAPANESE;
    }
}
