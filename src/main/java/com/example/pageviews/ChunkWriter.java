package com.example.pageviews;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Destination for encoded chunks. Implementations own the output format and the lifecycle of the
 * underlying output.
 */
public interface ChunkWriter extends Closeable, Flushable {

    void write(Chunk chunk) throws IOException;

    long getRowsWritten();
}
