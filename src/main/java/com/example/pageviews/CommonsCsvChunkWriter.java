package com.example.pageviews;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes chunks as delimited text with Apache Commons CSV.
 */
@Slf4j
public class CommonsCsvChunkWriter implements ChunkWriter {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
        private boolean header = true;
    }

    private final CSVPrinter printer;
    private long rows;

    public CommonsCsvChunkWriter(Writer out, Config cfg) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT
                .withDelimiter(cfg.getDelimiter())
                .withQuote(cfg.getQuoteChar())
                .withRecordSeparator('\n')
                .withNullString("");
        if (cfg.isHeader()) {
            format = format.withHeader(Chunk.COLUMN_NAMES.toArray(new String[0]));
        }
        this.printer = new CSVPrinter(out, format);
    }

    @Override
    public void write(Chunk chunk) throws IOException {
        for (int i = 0; i < chunk.size(); i++) {
            printer.printRecord(chunk.getRow(i));
            rows++;
            if ((rows % 100_000) == 0) {
                log.info("commons-csv wrote {} rows", rows);
                printer.flush();
            }
        }
    }

    @Override
    public long getRowsWritten() {
        return rows;
    }

    @Override
    public void flush() throws IOException {
        printer.flush();
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}
