package dev.lyricscache.codec;

import dev.lyricscache.core.DecodeException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib compression followed by Base64, so payloads can live in text fields.
 *
 * <p>The zlib stream header carries everything needed to inflate it, so {@link #decompress(String)}
 * works for output of any level.
 */
public final class CompressionCodec {
    public static final String METHOD = "zlib+base64";
    public static final int DEFAULT_LEVEL = 6;

    private static final int CHUNK = 8 * 1024;

    private final int defaultLevel;

    public CompressionCodec() {
        this(DEFAULT_LEVEL);
    }

    public CompressionCodec(int defaultLevel) {
        checkLevel(defaultLevel);
        this.defaultLevel = defaultLevel;
    }

    public Compressed compress(String text) {
        return compress(text, defaultLevel);
    }

    /**
     * Compresses UTF-8 text at the given zlib level (0..9).
     *
     * @throws IllegalArgumentException if the level is out of range
     */
    public Compressed compress(String text, int level) {
        Objects.requireNonNull(text, "text cannot be null");
        checkLevel(level);

        byte[] original = text.getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(level);
        byte[] compressed;
        try {
            deflater.setInput(original);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, original.length / 2));
            byte[] buf = new byte[CHUNK];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            compressed = out.toByteArray();
        } finally {
            deflater.end();
        }

        String encoded = Base64.getEncoder().encodeToString(compressed);
        double ratio = encoded.isEmpty() ? 0.0 : (double) original.length / encoded.length();
        CompressionStats stats = new CompressionStats(
                original.length, compressed.length, encoded.length(), ratio, METHOD, level);
        return new Compressed(encoded, stats);
    }

    /**
     * Reverses {@link #compress(String, int)}.
     *
     * @throws DecodeException if the input is not Base64, not a complete zlib stream, or not UTF-8
     */
    public String decompress(String encoded) {
        if (encoded == null) {
            throw new DecodeException("Encoded payload is null");
        }
        byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Payload is not valid Base64", e);
        }

        Inflater inflater = new Inflater();
        byte[] raw;
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, compressed.length * 3));
            byte[] buf = new byte[CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecodeException("Truncated zlib stream");
                }
                out.write(buf, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new DecodeException("Trailing bytes after zlib stream");
            }
            raw = out.toByteArray();
        } catch (DataFormatException e) {
            throw new DecodeException("Payload is not a valid zlib stream", e);
        } finally {
            inflater.end();
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Decompressed payload is not valid UTF-8", e);
        }
    }

    public int getDefaultLevel() {
        return defaultLevel;
    }

    private static void checkLevel(int level) {
        if (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("compression level must be 0..9, got " + level);
        }
    }
}
