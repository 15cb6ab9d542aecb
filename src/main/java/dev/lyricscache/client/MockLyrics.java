package dev.lyricscache.client;

/**
 * Deterministic placeholder lyrics for tests and offline runs.
 */
final class MockLyrics {
    private MockLyrics() {}

    static final String SOURCE = "mock_data";

    static String render(String song, String artist) {
        String by = artist == null ? "Unknown" : artist;
        return "This is a mock lyrics for " + song + " by " + by + "\n"
                + "\n"
                + "Verse 1:\n"
                + "Imagine the first verse of the song here\n"
                + "With multiple lines of text to simulate real lyrics\n"
                + "This helps us test the compression functionality\n"
                + "Without relying on external APIs that might have rate limits\n"
                + "\n"
                + "Chorus:\n"
                + "This is the " + song + " chorus\n"
                + "Repeated a few times\n"
                + "This is the " + song + " chorus\n"
                + "To make it more realistic\n"
                + "\n"
                + "Verse 2:\n"
                + "Second verse continues the song\n"
                + "With more lines to increase the text size\n"
                + "So we can properly test our compression\n"
                + "And see how well the caching system works\n"
                + "\n"
                + "Bridge:\n"
                + "A bridge section with different lyrics\n"
                + "To add variety to our mock song\n"
                + "\n"
                + "Chorus:\n"
                + "This is the " + song + " chorus\n"
                + "Repeated a few times\n"
                + "This is the " + song + " chorus\n"
                + "One last time for the end\n"
                + "\n"
                + "(End)\n";
    }
}
