package dev.lyricscache.codec;

import dev.lyricscache.core.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class CompressionCodecTest {

    private final CompressionCodec codec = new CompressionCodec();

    @Test
    void restoresTextExactly() {
        String[] samples = {
                "",
                "a",
                "Lemon\n夢ならばどれほどよかったでしょう\n未だにあなたのことを夢にみる\n",
                "emoji 🍋 and tabs\t\r\n",
        };
        for (String s : samples) {
            Compressed c = codec.compress(s);
            assertEquals(s, codec.decompress(c.encoded()));
        }
    }

    @Test
    void anyLevelDecodesWithDefaultCodec() {
        String text = "chorus line\n".repeat(200);
        for (int level = 0; level <= 9; level++) {
            Compressed c = codec.compress(text, level);
            assertEquals(level, c.stats().compressionLevel());
            assertEquals(text, new CompressionCodec(1).decompress(c.encoded()));
        }
    }

    @Test
    void repetitiveTextCompressesWell() {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < 100 * 1024) {
            sb.append("This is the Lemon chorus, repeated a few times\n");
        }
        Compressed c = codec.compress(sb.toString());
        CompressionStats stats = c.stats();

        assertTrue(stats.compressionRatio() > 3.0, "ratio was " + stats.compressionRatio());
        assertEquals(sb.toString().getBytes(java.nio.charset.StandardCharsets.UTF_8).length, stats.originalSizeBytes());
        assertEquals(c.encoded().length(), stats.encodedSizeBytes());
        assertTrue(stats.compressedSizeBytes() < stats.encodedSizeBytes());
        assertEquals(CompressionCodec.METHOD, stats.compressionMethod());
        assertEquals(CompressionCodec.DEFAULT_LEVEL, stats.compressionLevel());
    }

    @Test
    void emptyTextHasZeroOriginalSize() {
        CompressionStats stats = codec.compress("").stats();
        assertEquals(0, stats.originalSizeBytes());
        assertTrue(stats.encodedSizeBytes() > 0);
    }

    @Test
    void rejectsInvalidLevel() {
        assertThrows(IllegalArgumentException.class, () -> codec.compress("x", 10));
        assertThrows(IllegalArgumentException.class, () -> codec.compress("x", -1));
        assertThrows(IllegalArgumentException.class, () -> new CompressionCodec(42));
    }

    @Test
    void malformedInputRaisesDecodeException() {
        assertThrows(DecodeException.class, () -> codec.decompress(null));
        assertThrows(DecodeException.class, () -> codec.decompress("not base64 !!"));
        String notZlib = Base64.getEncoder().encodeToString("plain text".getBytes());
        assertThrows(DecodeException.class, () -> codec.decompress(notZlib));
    }

    @Test
    void truncatedStreamRaisesDecodeException() {
        byte[] full = Base64.getDecoder().decode(codec.compress("some lyrics ".repeat(50)).encoded());
        byte[] truncated = java.util.Arrays.copyOf(full, full.length / 2);
        String encoded = Base64.getEncoder().encodeToString(truncated);
        assertThrows(DecodeException.class, () -> codec.decompress(encoded));
    }
}
