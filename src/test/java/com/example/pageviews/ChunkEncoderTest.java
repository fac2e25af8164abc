package com.example.pageviews;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.junit.jupiter.api.Test;

class ChunkEncoderTest {

    private static Result<Pageview> row(String domainCode, String title, long views) {
        return LineParser.tryParse(domainCode + " " + title + " " + views + " 0");
    }

    private static List<Result<Pageview>> rows(int n) {
        return IntStream.range(0, n).mapToObj(i -> row("en", "Title_" + i, i)).collect(Collectors.toList());
    }

    private static ChunkEncoder.Config batchOf(int size) {
        ChunkEncoder.Config cfg = new ChunkEncoder.Config();
        cfg.setBatchSize(size);
        return cfg;
    }

    private static List<Chunk> encode(List<Result<Pageview>> input, ChunkEncoder.Config cfg) {
        return ChunkEncoder.encode(input.stream(), cfg).collect(Collectors.toList());
    }

    @Test
    void encodesAllSixColumns() {
        List<Chunk> chunks = encode(List.of(row("en", "Main_Page", 1000), row("de.m", "Startseite", 500),
                row("xx.unknown", "Foo", 1)), new ChunkEncoder.Config());
        assertEquals(1, chunks.size());
        Chunk chunk = chunks.get(0);
        assertEquals(3, chunk.size());

        assertEquals("en", chunk.getDomainCode(0));
        assertEquals("de.m", chunk.getDomainCode(1));
        assertEquals("Main_Page", chunk.getPageTitle(0));
        assertEquals("Startseite", chunk.getPageTitle(1));
        assertEquals(1000, chunk.getViews(0));
        assertEquals(500, chunk.getViews(1));
        assertEquals("en", chunk.getLanguage(0));
        assertEquals("de", chunk.getLanguage(1));
        assertEquals("wikipedia.org", chunk.getDomain(0));
        assertEquals("wikipedia.org", chunk.getDomain(1));
        assertNull(chunk.getDomain(2));
        assertTrue(chunk.getDomains().isNull(2));
        assertFalse(chunk.isMobile(0));
        assertTrue(chunk.isMobile(1));
    }

    @Test
    void dictionaryColumnsStoreEachValueOnce() {
        List<Chunk> chunks = encode(List.of(row("en", "A", 1), row("en.m", "B", 2), row("en", "C", 3),
                row("en.m", "D", 4)), new ChunkEncoder.Config());
        Chunk chunk = chunks.get(0);

        assertEquals(List.of("en", "en.m"), chunk.getDomainCodes().getDictionary());
        assertEquals(0, chunk.getDomainCodes().getKey(0));
        assertEquals(1, chunk.getDomainCodes().getKey(1));
        assertEquals(0, chunk.getDomainCodes().getKey(2));
        assertEquals(List.of("en"), chunk.getLanguages().getDictionary());
        assertEquals(List.of("wikipedia.org"), chunk.getDomains().getDictionary());
    }

    @Test
    void keepsUnsignedViewCounts() {
        Chunk chunk = encode(List.of(row("en", "A", 4294967295L)), new ChunkEncoder.Config()).get(0);
        assertEquals(4294967295L, chunk.getViews(0));
    }

    @Test
    void splitsIntoFullChunksAndRemainder() {
        List<Chunk> chunks = encode(rows(10), batchOf(3));
        assertEquals(List.of(3, 3, 3, 1), chunks.stream().map(Chunk::size).collect(Collectors.toList()));
    }

    @Test
    void exactMultipleHasNoTrailingChunk() {
        List<Chunk> chunks = encode(rows(9), batchOf(3));
        assertEquals(List.of(3, 3, 3), chunks.stream().map(Chunk::size).collect(Collectors.toList()));
    }

    @Test
    void chunkCountIsCeilingOfRowsOverBatchSize() {
        for (int n : new int[]{0, 1, 7, 8, 64}) {
            for (int b : new int[]{1, 2, 8, 100}) {
                List<Chunk> chunks = encode(rows(n), batchOf(b));
                assertEquals((n + b - 1) / b, chunks.size(), "n=" + n + " b=" + b);
                assertEquals(n, chunks.stream().mapToInt(Chunk::size).sum());
            }
        }
    }

    @Test
    void emptyInputYieldsNoChunks() {
        assertTrue(encode(List.of(), new ChunkEncoder.Config()).isEmpty());
        ChunkEncoder encoder = new ChunkEncoder(List.<Result<Pageview>>of().iterator(), new ChunkEncoder.Config());
        assertFalse(encoder.hasNext());
        assertThrows(NoSuchElementException.class, encoder::next);
    }

    @Test
    void failuresAreSkippedAndNotCounted() {
        List<Result<Pageview>> input = new ArrayList<>();
        input.add(row("en", "A", 1));
        input.add(LineParser.tryParse("en Broken"));
        input.add(row("en", "B", 2));
        input.add(LineParser.tryParse("en Broken many 0"));
        input.add(row("en", "C", 3));

        List<Chunk> chunks = encode(input, batchOf(2));
        assertEquals(2, chunks.size());
        assertEquals("A", chunks.get(0).getPageTitle(0));
        assertEquals("B", chunks.get(0).getPageTitle(1));
        assertEquals("C", chunks.get(1).getPageTitle(0));
    }

    @Test
    void onlyFailuresYieldNoChunks() {
        List<Result<Pageview>> input = List.of(LineParser.tryParse("en"), LineParser.tryParse("en A x 0"));
        assertTrue(encode(input, batchOf(1)).isEmpty());
    }

    @Test
    void preservesInputOrderAcrossChunks() {
        List<Chunk> chunks = encode(rows(25), batchOf(4));
        int expected = 0;
        for (Chunk chunk : chunks) {
            for (int i = 0; i < chunk.size(); i++) {
                assertEquals("Title_" + expected, chunk.getPageTitle(i));
                assertEquals(expected, chunk.getViews(i));
                expected++;
            }
        }
        assertEquals(25, expected);
    }

    @Test
    void pullsInputLazily() {
        List<Integer> pulled = new ArrayList<>();
        Stream<Result<Pageview>> source = IntStream.range(0, 100).boxed()
                .peek(pulled::add)
                .map(i -> row("en", "T" + i, i));
        ChunkEncoder encoder = new ChunkEncoder(source.iterator(), batchOf(10));
        encoder.next();
        assertTrue(pulled.size() <= 11, "pulled " + pulled.size());
    }

    @Test
    void dictionaryOverflowAbandonsChunkAndStops() {
        ChunkEncoder.Config cfg = batchOf(3);
        cfg.setMaxDictionaryEntries(2);
        List<Result<Pageview>> input = List.of(
                row("en", "A", 1), row("de", "B", 2), row("fr", "C", 3),
                row("fr", "D", 4), row("fr", "E", 5), row("fr", "F", 6));
        ChunkEncoder encoder = new ChunkEncoder(input.iterator(), cfg);

        ChunkEncodingException e = assertThrows(ChunkEncodingException.class, encoder::next);
        assertTrue(e.getMessage().contains("domain_code"), e.getMessage());
        assertFalse(encoder.hasNext());
    }

    @Test
    void chunksBeforeOverflowAreKept() {
        ChunkEncoder.Config cfg = batchOf(3);
        cfg.setMaxDictionaryEntries(2);
        List<Result<Pageview>> input = List.of(
                row("en", "A", 1), row("de", "B", 2), row("en", "C", 3),
                row("de.m", "D", 4), row("fr", "E", 5), row("it", "F", 6));
        ChunkEncoder encoder = new ChunkEncoder(input.iterator(), cfg);

        assertEquals(3, encoder.next().size());
        assertThrows(ChunkEncodingException.class, encoder::next);
        assertFalse(encoder.hasNext());
    }

    @Test
    void chunkIsAnArrowBatchWithDictionaries() {
        Chunk chunk = encode(List.of(row("en", "A", 1), row("de.m", "B", 4294967295L), row("en", "C", 3),
                row("xx.unknown", "D", 4)), new ChunkEncoder.Config()).get(0);
        VectorSchemaRoot root = chunk.getVectorSchemaRoot();

        assertEquals(4, root.getRowCount());
        assertEquals(Chunk.COLUMN_NAMES,
                root.getSchema().getFields().stream().map(Field::getName).collect(Collectors.toList()));
        assertInstanceOf(VarCharVector.class, root.getVector("page_title"));
        assertEquals(4294967295L, ((UInt4Vector) root.getVector("views")).getValueAsLong(1));
        assertEquals(1, ((BitVector) root.getVector("mobile")).get(1));

        IntVector domainCodeKeys = (IntVector) root.getVector("domain_code");
        DictionaryEncoding encoding = domainCodeKeys.getField().getDictionary();
        assertEquals(0, domainCodeKeys.get(2));
        Dictionary domainCodes = chunk.getDictionaryProvider().lookup(encoding.getId());
        assertEquals(3, domainCodes.getVector().getValueCount());
        assertEquals("de.m", domainCodes.getVector().getObject(domainCodeKeys.get(1)).toString());

        IntVector domainKeys = (IntVector) root.getVector("domain");
        assertTrue(domainKeys.isNull(3));
        assertEquals(1, chunk.getDictionaryProvider().lookup(domainKeys.getField().getDictionary().getId())
                .getVector().getValueCount());
    }

    @Test
    void closingChunksReleasesTheirBuffers() {
        try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE)) {
            ChunkEncoder encoder = new ChunkEncoder(rows(10).iterator(), batchOf(3), allocator);
            int seen = 0;
            while (encoder.hasNext()) {
                try (Chunk chunk = encoder.next()) {
                    seen += chunk.size();
                    assertTrue(allocator.getAllocatedMemory() > 0);
                }
            }
            assertEquals(10, seen);
            assertEquals(0, allocator.getAllocatedMemory());
        }
    }

    @Test
    void abandonedChunkReleasesItsBuffers() {
        ChunkEncoder.Config cfg = batchOf(10);
        cfg.setMaxDictionaryEntries(1);
        try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE)) {
            ChunkEncoder encoder = new ChunkEncoder(List.of(row("en", "A", 1), row("de", "B", 2)).iterator(),
                    cfg, allocator);
            assertThrows(ChunkEncodingException.class, encoder::next);
            assertEquals(0, allocator.getAllocatedMemory());
        }
    }

    @Test
    void allocationFailureIsAnEncodingError() {
        try (BufferAllocator allocator = new RootAllocator(1024)) {
            ChunkEncoder encoder = new ChunkEncoder(rows(5).iterator(), batchOf(5), allocator);
            ChunkEncodingException e = assertThrows(ChunkEncodingException.class, encoder::next);
            assertInstanceOf(OutOfMemoryException.class, e.getCause());
            assertFalse(encoder.hasNext());
            assertEquals(0, allocator.getAllocatedMemory());
        }
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChunkEncoder(List.<Result<Pageview>>of().iterator(), batchOf(0)));
        assertThrows(IllegalArgumentException.class,
                () -> new ChunkEncoder(List.<Result<Pageview>>of().iterator(), batchOf(-5)));
    }

    @Test
    void defaultBatchSizeIsParquetRowGroupSize() {
        assertEquals(122_880, new ChunkEncoder.Config().getBatchSize());
    }
}
