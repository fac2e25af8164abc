package com.example.pageviews;

import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Filters a pageviews dump and exports the accepted rows as delimited text.
 *
 * Example usage:
 * java -jar pageviews-stream.jar pageviews-20240803-060000.gz out.csv univocity 122880 --languages=en,de --min-views=100
 */
@Slf4j
public class PageviewsMain {

    static final String USAGE = "Usage: java -jar pageviews-stream.jar <inputFile> <outputFile|-> [writer=commons|univocity] [batchSize]"
            + " [--line-regex=R] [--domain-codes=a,b] [--page-title=R] [--min-views=N] [--max-views=N]"
            + " [--languages=a,b] [--domains=a,b] [--mobile=true|false] [--delimiter=C] [--no-header]"
            + " [--max-logged-errors=N] [--fail-fast]";

    @Data
    public static class Options {
        private File inputFile;
        private File outputFile; // null writes to stdout
        private String writer = "commons"; // or "univocity"
        private int batchSize = ChunkEncoder.DEFAULT_BATCH_SIZE;
        private char delimiter = ',';
        private boolean header = true;
        private int maxLoggedErrors = 1000;
        private boolean failFast = false;
        private FilterSpec filter = FilterSpec.NONE;
    }

    @Value
    public static class RunSummary {
        long records;
        long failures;
        long chunks;
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.out.println(USAGE);
            System.out.println("Example: java -jar ... pageviews-20240803-060000.gz out.csv univocity 122880 --languages=en --mobile=true");
            return;
        }
        Options options = parseArgs(args);
        log.info("Options: {}", options);
        try {
            run(options);
        } catch (Exception e) {
            log.error("Export failed: {}", e.getMessage(), e);
            throw e;
        }
    }

    static Options parseArgs(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("Expected <inputFile> <outputFile>. " + USAGE);
        }
        Options options = new Options();
        FilterSpec.FilterSpecBuilder filter = FilterSpec.builder();
        int positional = 0;
        for (String arg : args) {
            if (arg.startsWith("--")) {
                applyOption(options, filter, arg);
                continue;
            }
            switch (positional++) {
                case 0:
                    options.setInputFile(new File(arg));
                    break;
                case 1:
                    options.setOutputFile("-".equals(arg) ? null : new File(arg));
                    break;
                case 2:
                    options.setWriter(arg);
                    break;
                case 3:
                    options.setBatchSize(parseInt("batchSize", arg));
                    break;
                default:
                    throw new IllegalArgumentException("Unexpected argument '" + arg + "'. " + USAGE);
            }
        }
        if (!"commons".equalsIgnoreCase(options.getWriter()) && !"univocity".equalsIgnoreCase(options.getWriter())) {
            throw new IllegalArgumentException("Unknown writer '" + options.getWriter() + "'. " + USAGE);
        }
        if (options.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + options.getBatchSize());
        }
        options.setFilter(filter.build());
        return options;
    }

    private static void applyOption(Options options, FilterSpec.FilterSpecBuilder filter, String arg) {
        int eq = arg.indexOf('=');
        String name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
        String value = eq < 0 ? null : arg.substring(eq + 1);
        switch (name) {
            case "no-header":
                options.setHeader(false);
                return;
            case "fail-fast":
                options.setFailFast(true);
                return;
            default:
                break;
        }
        if (value == null) {
            throw new IllegalArgumentException("Option --" + name + " needs a value. " + USAGE);
        }
        switch (name) {
            case "line-regex":
                filter.lineRegex(value);
                break;
            case "domain-codes":
                filter.domainCodes(splitList(value));
                break;
            case "page-title":
                filter.pageTitle(value);
                break;
            case "min-views":
                filter.minViews(parseLong(name, value));
                break;
            case "max-views":
                filter.maxViews(parseLong(name, value));
                break;
            case "languages":
                filter.languages(splitList(value));
                break;
            case "domains":
                filter.domains(splitList(value));
                break;
            case "mobile":
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new IllegalArgumentException("--mobile must be true or false, got '" + value + "'");
                }
                filter.mobile(Boolean.parseBoolean(value));
                break;
            case "delimiter":
                if (value.length() != 1) {
                    throw new IllegalArgumentException("--delimiter must be a single character, got '" + value + "'");
                }
                options.setDelimiter(value.charAt(0));
                break;
            case "max-logged-errors":
                options.setMaxLoggedErrors(parseInt(name, value));
                break;
            default:
                throw new IllegalArgumentException("Unknown option --" + name + ". " + USAGE);
        }
    }

    /**
     * Runs the export described by {@code options}.
     *
     * @throws PageviewException the first line failure, when {@code failFast} is set
     */
    static RunSummary run(Options options) throws IOException, PageviewException {
        ChunkEncoder.Config encoderConfig = new ChunkEncoder.Config();
        encoderConfig.setBatchSize(options.getBatchSize());

        long start = System.currentTimeMillis();
        FailureCounter counter = new FailureCounter(options);
        try (Stream<Result<Pageview>> records = PageviewPipeline.streamFromFile(options.getInputFile().toPath(), options.getFilter());
             ChunkWriter writer = openWriter(options)) {
            ChunkEncoder encoder = new ChunkEncoder(counter.inspect(records.iterator()), encoderConfig);
            PageviewPipeline.ExportSummary exported = PageviewPipeline.export(encoder, writer);
            long end = System.currentTimeMillis();
            log.info("Completed. Records: {}, Failures: {}, Chunks: {}, Time(s): {}, RPS: {}",
                    exported.getRows(), counter.failures, exported.getChunks(), (end - start) / 1000.0,
                    exported.getRows() / Math.max(1, (end - start) / 1000));
            return new RunSummary(exported.getRows(), counter.failures, exported.getChunks());
        } catch (FailFastAbort abort) {
            throw abort.failure;
        }
    }

    static ChunkWriter openWriter(Options options) throws IOException {
        Writer out = options.getOutputFile() == null
                ? new BufferedWriter(new OutputStreamWriter(new StdoutStream(System.out), StandardCharsets.UTF_8))
                : Files.newBufferedWriter(options.getOutputFile().toPath(), StandardCharsets.UTF_8);
        if ("univocity".equalsIgnoreCase(options.getWriter())) {
            UniVocityChunkWriter.Config cfg = new UniVocityChunkWriter.Config();
            cfg.setDelimiter(options.getDelimiter());
            cfg.setHeader(options.isHeader());
            return new UniVocityChunkWriter(out, cfg);
        }
        CommonsCsvChunkWriter.Config cfg = new CommonsCsvChunkWriter.Config();
        cfg.setDelimiter(options.getDelimiter());
        cfg.setHeader(options.isHeader());
        return new CommonsCsvChunkWriter(out, cfg);
    }

    private static Set<String> splitList(String value) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : value.split(",")) {
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    /** Keeps stdout open when the export writer is closed. */
    private static final class StdoutStream extends FilterOutputStream {
        StdoutStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }

    /** Counts and logs failed lines as they pass on their way to the encoder. */
    private static final class FailureCounter {
        private final Options options;
        private long failures;

        FailureCounter(Options options) {
            this.options = options;
        }

        Iterator<Result<Pageview>> inspect(Iterator<Result<Pageview>> it) {
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public Result<Pageview> next() {
                    Result<Pageview> result = it.next();
                    if (result.isFailed()) {
                        failures++;
                        if (options.isFailFast()) {
                            throw new FailFastAbort(result.getError());
                        }
                        if (failures <= options.getMaxLoggedErrors()) {
                            log.warn("Skipping line: {}", result.getError().getMessage());
                        }
                    }
                    return result;
                }
            };
        }
    }

    private static final class FailFastAbort extends RuntimeException {
        private final PageviewException failure;

        FailFastAbort(PageviewException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }
}
