package com.example.pageviews;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;

/**
 * Produces the raw lines of a pageviews dump as {@code Result<String>} values, in file order.
 */
@Slf4j
public final class LineSources {

    static final int BUFFER_SIZE = 256 * 1024;

    private LineSources() {}

    /**
     * Opens a local dump. Names ending in {@code .gz} are decompressed on the fly.
     *
     * @throws IOException if the file cannot be opened
     */
    public static Stream<Result<String>> fromFile(Path file) throws IOException {
        return fromFile(file, MappedFileInputStream.DEFAULT_REGION_SIZE);
    }

    public static Stream<Result<String>> fromFile(Path file, long regionSize) throws IOException {
        InputStream in = new MappedFileInputStream(file, regionSize);
        try {
            if (file.getFileName().toString().endsWith(".gz")) {
                in = new GZIPInputStream(in, BUFFER_SIZE);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        log.info("Reading {}", file);
        return fromStream(in);
    }

    /**
     * Splits {@code in} on {@code '\n'} and decodes each line as UTF-8, dropping one trailing
     * {@code '\r'}. A line that is not valid UTF-8 becomes a {@link ReadFailureException} result
     * and reading continues with the next line. An {@link IOException} from {@code in} becomes a
     * single failure, after which the stream ends. Closing the stream closes {@code in}.
     */
    public static Stream<Result<String>> fromStream(InputStream in) {
        return stream(new LineIterator(in)).onClose(() -> {
            try {
                in.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    public static Stream<Result<String>> fromLines(Iterable<String> lines) {
        Iterator<String> it = lines.iterator();
        return stream(new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Result<String> next() {
                return Result.ok(it.next());
            }
        });
    }

    public static Stream<Result<String>> of(String... lines) {
        return fromLines(Arrays.asList(lines));
    }

    private static <T> Stream<T> stream(Iterator<T> it) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private static final class LineIterator implements Iterator<Result<String>> {
        private final InputStream in;
        private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        private final byte[] buffer = new byte[BUFFER_SIZE];
        private int pos;
        private int limit;
        private byte[] line = new byte[1024];
        private int length;
        private Result<String> pending;
        private boolean done;
        private long lines;

        LineIterator(InputStream in) {
            this.in = in;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !done) {
                pending = readLine();
            }
            return pending != null;
        }

        @Override
        public Result<String> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Result<String> next = pending;
            pending = null;
            return next;
        }

        private Result<String> readLine() {
            length = 0;
            try {
                while (true) {
                    if (pos == limit) {
                        int n = in.read(buffer, 0, buffer.length);
                        if (n < 0) {
                            done = true;
                            if (length == 0) {
                                log.debug("End of input after {} lines", lines);
                                return null;
                            }
                            return decode();
                        }
                        pos = 0;
                        limit = n;
                    }
                    int start = pos;
                    while (pos < limit && buffer[pos] != '\n') {
                        pos++;
                    }
                    append(start, pos - start);
                    if (pos < limit) {
                        pos++;
                        return decode();
                    }
                }
            } catch (IOException e) {
                done = true;
                log.warn("Read failed after {} lines: {}", lines, e.getMessage());
                return Result.failed(new ReadFailureException(e));
            }
        }

        private void append(int start, int count) {
            if (length + count > line.length) {
                line = Arrays.copyOf(line, Math.max(line.length * 2, length + count));
            }
            System.arraycopy(buffer, start, line, length, count);
            length += count;
        }

        private Result<String> decode() {
            lines++;
            int end = length > 0 && line[length - 1] == '\r' ? length - 1 : length;
            try {
                return Result.ok(decoder.decode(ByteBuffer.wrap(line, 0, end)).toString());
            } catch (CharacterCodingException e) {
                log.debug("Line {} is not valid UTF-8", lines);
                return Result.failed(new ReadFailureException(e));
            }
        }
    }
}
