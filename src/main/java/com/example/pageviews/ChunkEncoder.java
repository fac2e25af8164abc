package com.example.pageviews;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.util.OversizedAllocationException;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Groups parsed pageviews into {@link Chunk}s of at most {@code batchSize} rows.
 *
 * Failed results are skipped and do not count towards the batch size. A chunk is emitted when it
 * is full or when the input is exhausted; an empty trailing chunk is never emitted.
 *
 * If a dictionary cannot take another value, or a column buffer cannot grow, the in-progress chunk
 * is released, {@link #next()} throws {@link ChunkEncodingException} and the encoder reports no
 * further chunks.
 */
@Slf4j
public class ChunkEncoder implements Iterator<Chunk> {

    /** Default Parquet row group size. */
    public static final int DEFAULT_BATCH_SIZE = 122_880;

    @Data
    public static class Config {
        private int batchSize = DEFAULT_BATCH_SIZE;
        // Keys are signed 32-bit integers.
        private int maxDictionaryEntries = Integer.MAX_VALUE;
    }

    private final Iterator<Result<Pageview>> source;
    private final Config cfg;
    private final BufferAllocator allocator;

    private Chunk pending;
    private boolean done;
    private long chunks;

    public ChunkEncoder(Iterator<Result<Pageview>> source, Config cfg) {
        this(source, cfg, RootAllocatorFactory.INSTANCE.getOrCreateRootAllocator(Long.MAX_VALUE));
    }

    /** Allocates chunk buffers from {@code allocator}; the caller closes emitted chunks before it. */
    public ChunkEncoder(Iterator<Result<Pageview>> source, Config cfg, BufferAllocator allocator) {
        if (cfg.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + cfg.getBatchSize());
        }
        if (cfg.getMaxDictionaryEntries() <= 0) {
            throw new IllegalArgumentException("maxDictionaryEntries must be positive: "
                    + cfg.getMaxDictionaryEntries());
        }
        this.source = source;
        this.cfg = cfg;
        this.allocator = allocator;
    }

    public static Stream<Chunk> encode(Stream<Result<Pageview>> records, Config cfg) {
        ChunkEncoder encoder = new ChunkEncoder(records.iterator(), cfg);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(encoder, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(records::close);
    }

    public static Stream<Chunk> encode(Stream<Result<Pageview>> records) {
        return encode(records, new Config());
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !done) {
            pending = fill();
        }
        return pending != null;
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Chunk chunk = pending;
        pending = null;
        return chunk;
    }

    private Chunk fill() {
        ColumnBuilders columns = new ColumnBuilders(cfg, allocator);
        try {
            while (columns.size() < cfg.getBatchSize() && source.hasNext()) {
                Result<Pageview> result = source.next();
                if (result.isFailed()) {
                    continue;
                }
                columns.add(result.get());
            }
            if (columns.size() < cfg.getBatchSize()) {
                done = true;
            }
            if (columns.size() == 0) {
                return null;
            }
            Chunk chunk = columns.build();
            chunks++;
            log.debug("Encoded chunk {} with {} rows", chunks, chunk.size());
            return chunk;
        } catch (ChunkEncodingException e) {
            done = true;
            log.error("Abandoning chunk {} after {} rows: {}", chunks, columns.size(), e.getMessage());
            throw e;
        } finally {
            columns.close();
        }
    }

    /** Arrow vectors for one in-progress chunk. Released on close unless a chunk was built. */
    private static final class ColumnBuilders implements AutoCloseable {
        private final StringDictionaryBuilder domainCodes;
        private final StringDictionaryBuilder languages;
        private final StringDictionaryBuilder domains;
        private final VarCharVector pageTitles;
        private final UInt4Vector views;
        private final BitVector mobile;
        private int rows;
        private boolean allocated;
        private boolean built;

        ColumnBuilders(Config cfg, BufferAllocator allocator) {
            domainCodes = new StringDictionaryBuilder(Chunk.DOMAIN_CODE, cfg.getMaxDictionaryEntries(), allocator);
            languages = new StringDictionaryBuilder(Chunk.LANGUAGE, cfg.getMaxDictionaryEntries(), allocator);
            domains = new StringDictionaryBuilder(Chunk.DOMAIN, cfg.getMaxDictionaryEntries(), allocator);
            pageTitles = new VarCharVector(Chunk.PAGE_TITLE, allocator);
            views = new UInt4Vector(Chunk.VIEWS, allocator);
            mobile = new BitVector(Chunk.MOBILE, allocator);
        }

        int size() {
            return rows;
        }

        void add(Pageview pageview) {
            try {
                if (!allocated) {
                    allocated = true;
                    domainCodes.allocateNew();
                    languages.allocateNew();
                    domains.allocateNew();
                    pageTitles.allocateNew();
                    views.allocateNew();
                    mobile.allocateNew();
                }
                // an overflow here abandons the whole chunk
                domainCodes.add(pageview.getDomainCode());
                languages.add(pageview.getLanguage());
                domains.add(pageview.getDomain());
                pageTitles.setSafe(rows, pageview.getPageTitle().getBytes(StandardCharsets.UTF_8));
                views.setSafe(rows, (int) pageview.getViews());
                mobile.setSafe(rows, pageview.isMobile() ? 1 : 0);
                rows++;
            } catch (OutOfMemoryException | OversizedAllocationException e) {
                throw new ChunkEncodingException("Cannot grow chunk past " + rows + " rows: " + e.getMessage(), e);
            }
        }

        Chunk build() {
            Chunk chunk = new Chunk(domainCodes.build(), pageTitles, views, languages.build(), domains.build(), mobile,
                    rows);
            built = true;
            return chunk;
        }

        @Override
        public void close() {
            if (!built) {
                domainCodes.close();
                languages.close();
                domains.close();
                pageTitles.close();
                views.close();
                mobile.close();
            }
        }
    }
}
