package com.example.pageviews;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;
import java.util.zip.GZIPOutputStream;

/**
 * Test data generator to create synthetic pageviews dumps for performance testing.
 *
 * Usage example:
 *   java -cp ... com.example.pageviews.PageviewsDataGenerator /tmp/pageviews-test.gz 1000000
 *
 * Rows mix every domain code shape, quoted titles and non-ASCII titles. Names ending in .gz are
 * gzip compressed like the published dumps.
 */
@Slf4j
public class PageviewsDataGenerator {

    static final String[] DOMAIN_CODES = {
            "en", "en.m", "de", "de.m", "ja", "uk.b", "fr.v", "fr.m.v", "en.d", "no.zero",
            "commons.m", "meta.m.m", "en.voy", "ko", "\"\"", "xx.unknown"
    };

    static final String[] TITLES = {
            "Main_Page", "Copenhagen", "Ядро_Linux/Модулі", "서울_지하철_7호선", "\\(^o^)/チエ",
            "\"\\\"Hello,_World!\\\"_(chương_trình_máy_tính)\"", "\"Pryp\\\"jat'\"", "Special:Search", "-"
    };

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.out.println("Usage: PageviewsDataGenerator <outputFile> <numRows> [seed]");
            System.out.println("Example: PageviewsDataGenerator /tmp/pageviews-test.gz 500000");
            return;
        }
        Path out = Paths.get(args[0]);
        long numRows = Long.parseLong(args[1]);
        long seed = args.length > 2 ? Long.parseLong(args[2]) : 12345L;
        generate(out, numRows, seed);
    }

    public static void generate(Path out, long numRows, long seed) throws IOException {
        try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(out));
             OutputStream body = out.getFileName().toString().endsWith(".gz") ? new GZIPOutputStream(file) : file;
             Writer writer = new OutputStreamWriter(body, StandardCharsets.UTF_8)) {
            Random rnd = new Random(seed);
            for (long i = 0; i < numRows; i++) {
                writer.write(line(rnd));
                writer.write('\n');
                if (i > 0 && (i % 100_000) == 0) {
                    log.info("Generated {} rows", i);
                }
            }
        }
        log.info("Wrote test file {} rows={}", out.toAbsolutePath(), numRows);
    }

    static String line(Random rnd) {
        String domainCode = DOMAIN_CODES[rnd.nextInt(DOMAIN_CODES.length)];
        String title = TITLES[rnd.nextInt(TITLES.length)];
        int views = 1 + rnd.nextInt(500);
        return domainCode + ' ' + title + ' ' + views + " 0";
    }
}
