package com.example.pageviews;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Wires a line source through the line filter, the parser and the record filter.
 *
 * All stages are lazy: a line is read, filtered and parsed only when the consumer pulls the next
 * element. Failures are yielded in place and never stop the stream. Closing the returned stream
 * closes the underlying source.
 */
@Slf4j
public final class PageviewPipeline {

    @Value
    public static class ExportSummary {
        long chunks;
        long rows;
    }

    private PageviewPipeline() {}

    public static Stream<Result<Pageview>> run(Stream<Result<String>> source, FilterSpec spec) {
        FilterEngine filter = new FilterEngine(spec);
        Stream<Result<String>> lines = filter.getSpec().hasPreFilters() ? source.filter(filter::acceptsLine) : source;
        Stream<Result<Pageview>> records = lines.map(line -> line.flatMap(LineParser::parse));
        return filter.getSpec().hasPostFilters() ? records.filter(filter::acceptsRecord) : records;
    }

    public static Stream<Result<Pageview>> streamFromFile(Path file, FilterSpec spec) throws IOException {
        return run(LineSources.fromFile(file), spec);
    }

    public static Stream<Chunk> chunksFromFile(Path file, FilterSpec spec, ChunkEncoder.Config cfg)
            throws IOException {
        return ChunkEncoder.encode(streamFromFile(file, spec), cfg);
    }

    /**
     * Encodes every accepted record of {@code file} and hands the chunks to {@code writer}.
     * Each chunk is closed once written. The writer is flushed but not closed.
     */
    public static ExportSummary exportFile(Path file, FilterSpec spec, ChunkEncoder.Config cfg, ChunkWriter writer)
            throws IOException {
        try (Stream<Chunk> chunks = chunksFromFile(file, spec, cfg)) {
            return export(chunks.iterator(), writer);
        }
    }

    static ExportSummary export(Iterator<Chunk> chunks, ChunkWriter writer) throws IOException {
        long count = 0;
        long rows = 0;
        while (chunks.hasNext()) {
            try (Chunk chunk = chunks.next()) {
                writer.write(chunk);
                count++;
                rows += chunk.size();
            }
        }
        writer.flush();
        log.info("Exported {} rows in {} chunks", rows, count);
        return new ExportSummary(count, rows);
    }
}
