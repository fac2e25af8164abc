package com.example.pageviews;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads a file through a sliding memory-mapped region of at most {@code regionSize} bytes.
 * The previous region is unmapped before the next one is mapped, so a multi-gigabyte dump never
 * holds more than one region of address space.
 */
@Slf4j
public class MappedFileInputStream extends InputStream {

    public static final long DEFAULT_REGION_SIZE = 64L * 1024 * 1024;

    private final FileChannel channel;
    private final long fileSize;
    private final long regionSize;
    private long position;
    private MappedByteBuffer region;

    public MappedFileInputStream(Path file, long regionSize) throws IOException {
        if (regionSize <= 0) {
            throw new IllegalArgumentException("regionSize must be positive: " + regionSize);
        }
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.fileSize = channel.size();
        this.regionSize = regionSize;
        try {
            advance();
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    public MappedFileInputStream(Path file) throws IOException {
        this(file, DEFAULT_REGION_SIZE);
    }

    private void advance() throws IOException {
        unmap(region);
        region = null;
        if (position >= fileSize) {
            return;
        }
        long size = Math.min(regionSize, fileSize - position);
        region = channel.map(FileChannel.MapMode.READ_ONLY, position, size);
        log.debug("Mapped region: start={}, size={}", position, size);
        position += size;
    }

    @Override
    public int read() throws IOException {
        while (region != null) {
            if (region.hasRemaining()) {
                return region.get() & 0xFF;
            }
            advance();
        }
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        int total = 0;
        while (len > 0 && region != null) {
            if (!region.hasRemaining()) {
                advance();
                continue;
            }
            int n = Math.min(len, region.remaining());
            region.get(b, off, n);
            off += n;
            len -= n;
            total += n;
        }
        return total == 0 ? -1 : total;
    }

    @Override
    public int available() {
        long left = fileSize - position + (region == null ? 0 : region.remaining());
        return (int) Math.min(Integer.MAX_VALUE, left);
    }

    @Override
    public void close() throws IOException {
        try {
            unmap(region);
            region = null;
        } finally {
            channel.close();
        }
    }

    /**
     * Releases a mapped region eagerly through {@code sun.misc.Unsafe.invokeCleaner}. When that is
     * not accessible the region is left to the garbage collector.
     */
    private static void unmap(MappedByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field theUnsafe = unsafeClass.getDeclaredField("theUnsafe");
            theUnsafe.setAccessible(true);
            Method invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
            invokeCleaner.invoke(theUnsafe.get(null), buffer);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Could not unmap region eagerly, leaving it to GC: {}", e.toString());
        }
    }
}
