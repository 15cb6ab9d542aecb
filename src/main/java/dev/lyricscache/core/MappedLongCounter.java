package dev.lyricscache.core;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Insertion sequence persisted in an 8-byte memory-mapped file next to the RocksDB data.
 * Thread-safe within a single process.
 */
public final class MappedLongCounter implements AutoCloseable {
    private static final int SIZE = 8;

    private final RandomAccessFile file;
    private final FileChannel channel;
    private final MappedByteBuffer mapped;
    private final AtomicLong value;

    private MappedLongCounter(RandomAccessFile file, MappedByteBuffer mapped, long initial) {
        this.file = file;
        this.channel = file.getChannel();
        this.mapped = mapped;
        this.value = new AtomicLong(initial);
    }

    public static MappedLongCounter open(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw");
            try {
                if (raf.length() < SIZE) {
                    raf.setLength(SIZE);
                }
                MappedByteBuffer mbb = raf.getChannel().map(FileChannel.MapMode.READ_WRITE, 0, SIZE);
                mbb.order(ByteOrder.BIG_ENDIAN);
                return new MappedLongCounter(raf, mbb, Math.max(0L, mbb.getLong(0)));
            } catch (IOException | RuntimeException e) {
                raf.close();
                throw e;
            }
        } catch (IOException e) {
            throw new CacheStoreException("Failed to open sequence counter at " + path, e);
        }
    }

    public long get() {
        return value.get();
    }

    public synchronized long incrementAndGet() {
        if (value.get() == Long.MAX_VALUE) {
            throw new IllegalStateException("Insertion sequence overflow (Long.MAX_VALUE)");
        }
        long v = value.incrementAndGet();
        write(v);
        return v;
    }

    public synchronized void set(long v) {
        value.set(v);
        write(v);
    }

    private void write(long v) {
        ByteBuffer tmp = ByteBuffer.allocate(SIZE).order(ByteOrder.BIG_ENDIAN).putLong(v);
        tmp.flip();
        mapped.position(0);
        mapped.put(tmp);
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            mapped.force();
        } finally {
            channel.close();
            file.close();
        }
    }
}
