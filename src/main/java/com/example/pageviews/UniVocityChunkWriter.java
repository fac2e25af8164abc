package com.example.pageviews;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.Writer;

/**
 * Writes chunks as delimited text with the uniVocity CSV writer.
 */
@Slf4j
public class UniVocityChunkWriter implements ChunkWriter {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
        private boolean header = true;
    }

    private final CsvWriter writer;
    private long rows;

    public UniVocityChunkWriter(Writer out, Config cfg) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setDelimiter(cfg.getDelimiter());
        settings.getFormat().setQuote(cfg.getQuoteChar());
        settings.getFormat().setLineSeparator("\n");
        settings.setNullValue("");
        settings.setQuoteEscapingEnabled(true);
        this.writer = new CsvWriter(out, settings);
        if (cfg.isHeader()) {
            writer.writeHeaders(Chunk.COLUMN_NAMES);
        }
    }

    @Override
    public void write(Chunk chunk) {
        for (int i = 0; i < chunk.size(); i++) {
            writer.writeRow(chunk.getRow(i));
            rows++;
            if (rows % 100_000 == 0) {
                log.info("uniVocity wrote {} rows", rows);
                writer.flush();
            }
        }
    }

    @Override
    public long getRowsWritten() {
        return rows;
    }

    @Override
    public void flush() {
        writer.flush();
    }

    @Override
    public void close() {
        writer.close();
    }
}
